package com.newsboard.service.browser;

import com.microsoft.playwright.Frame;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.AriaRole;
import com.microsoft.playwright.options.ViewportSize;
import com.microsoft.playwright.options.WaitForSelectorState;
import com.newsboard.collectors.overlay.OverlayCandidate;
import com.newsboard.collectors.overlay.OverlayPage;
import com.newsboard.collectors.overlay.OverlayScope;
import com.newsboard.collectors.overlay.Viewport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

class PlaywrightOverlayPage implements OverlayPage {
    static final String HANDLE_ATTRIBUTE = "data-newsboard-overlay";

    // Tags every fixed/sticky element so remove() can find it again.
    private static final String COLLECT_POSITIONED = """
            attr => {
              const found = [];
              let next = 0;
              for (const el of document.querySelectorAll('body *')) {
                const style = window.getComputedStyle(el);
                if (style.position !== 'fixed' && style.position !== 'sticky') continue;
                const rect = el.getBoundingClientRect();
                const handle = String(next++);
                el.setAttribute(attr, handle);
                found.push({
                  handle,
                  position: style.position,
                  zIndex: parseInt(style.zIndex, 10) || 0,
                  width: rect.width,
                  height: rect.height,
                  role: el.getAttribute('role') || '',
                  className: typeof el.className === 'string' ? el.className : '',
                  elementId: el.id || '',
                  text: (el.innerText || '').trim().slice(0, 200)
                });
              }
              return found;
            }
            """;

    private static final String REMOVE_TAGGED = """
            ([attr, handles]) => {
              let removed = 0;
              for (const handle of handles) {
                const el = document.querySelector('[' + attr + '="' + handle + '"]');
                if (el) { el.remove(); removed++; }
              }
              document.documentElement.style.overflow = 'auto';
              document.body.style.overflow = 'auto';
              return removed;
            }
            """;

    private final Page page;

    PlaywrightOverlayPage(Page page) {
        this.page = page;
    }

    @Override
    public void pressKey(String key) {
        page.keyboard().press(key);
    }

    @Override
    public boolean clickButtonNamed(Pattern name, Duration visibleTimeout, Duration clickTimeout) {
        return clickWhenVisible(page.getByRole(AriaRole.BUTTON, new Page.GetByRoleOptions().setName(name)),
                visibleTimeout, clickTimeout);
    }

    @Override
    public boolean clickFirstVisible(String selector, Duration visibleTimeout, Duration clickTimeout) {
        return clickWhenVisible(page.locator(selector), visibleTimeout, clickTimeout);
    }

    @Override
    public List<OverlayScope> framesMatching(Pattern urlPattern) {
        List<OverlayScope> scopes = new ArrayList<>();
        for (Frame frame : page.frames()) {
            if (frame != page.mainFrame() && urlPattern.matcher(frame.url()).find()) {
                scopes.add(new FrameScope(frame));
            }
        }
        return scopes;
    }

    @Override
    public Viewport viewport() {
        ViewportSize size = page.viewportSize();
        if (size == null) {
            return new Viewport(PlaywrightDriverFactory.VIEWPORT_WIDTH, PlaywrightDriverFactory.VIEWPORT_HEIGHT);
        }
        return new Viewport(size.width, size.height);
    }

    @Override
    public List<OverlayCandidate> positionedElements() {
        Object raw = page.evaluate(COLLECT_POSITIONED, HANDLE_ATTRIBUTE);
        List<OverlayCandidate> candidates = new ArrayList<>();
        if (!(raw instanceof List<?> rows)) {
            return candidates;
        }
        for (Object row : rows) {
            if (row instanceof Map<?, ?> fields) {
                candidates.add(new OverlayCandidate(
                        string(fields.get("handle")),
                        string(fields.get("position")),
                        (int) number(fields.get("zIndex")),
                        number(fields.get("width")),
                        number(fields.get("height")),
                        string(fields.get("role")),
                        string(fields.get("className")),
                        string(fields.get("elementId")),
                        string(fields.get("text"))
                ));
            }
        }
        return candidates;
    }

    @Override
    public int remove(List<OverlayCandidate> elements) {
        if (elements.isEmpty()) {
            return 0;
        }
        List<String> handles = elements.stream().map(OverlayCandidate::handle).toList();
        Object removed = page.evaluate(REMOVE_TAGGED, List.of(HANDLE_ATTRIBUTE, handles));
        return (int) number(removed);
    }

    static boolean clickWhenVisible(Locator locator, Duration visibleTimeout, Duration clickTimeout) {
        Locator first = locator.first();
        try {
            first.waitFor(new Locator.WaitForOptions()
                    .setState(WaitForSelectorState.VISIBLE)
                    .setTimeout(visibleTimeout.toMillis()));
        } catch (TimeoutError notVisible) {
            return false;
        }
        first.click(new Locator.ClickOptions().setTimeout(clickTimeout.toMillis()));
        return true;
    }

    private static String string(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static double number(Object value) {
        return value instanceof Number n ? n.doubleValue() : 0;
    }

    private static final class FrameScope implements OverlayScope {
        private final Frame frame;

        private FrameScope(Frame frame) {
            this.frame = frame;
        }

        @Override
        public boolean clickButtonNamed(Pattern name, Duration visibleTimeout, Duration clickTimeout) {
            return clickWhenVisible(frame.getByRole(AriaRole.BUTTON, new Frame.GetByRoleOptions().setName(name)),
                    visibleTimeout, clickTimeout);
        }

        @Override
        public boolean clickFirstVisible(String selector, Duration visibleTimeout, Duration clickTimeout) {
            return clickWhenVisible(frame.locator(selector), visibleTimeout, clickTimeout);
        }
    }
}
