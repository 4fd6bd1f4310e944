package com.newsboard.collectors.scoring;

import com.newsboard.core.model.Candidate;
import com.newsboard.core.util.TextUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

public class CandidateExtractor {
    private static final Logger LOGGER = Logger.getLogger(CandidateExtractor.class.getName());

    public static final String HAS_IMAGE = "hasImage";
    public static final String HAS_HEADING = "hasHeading";
    public static final String HAS_H1 = "hasH1";
    public static final String IN_MAIN = "inMain";
    public static final String TITLE_LENGTH = "titleLength";

    private static final String HEADINGS = "h1,h2,h3";

    public List<List<Candidate>> extract(Document document, SourceProfile profile) {
        String base = document.location() == null || document.location().isBlank()
                ? profile.homeUrl()
                : document.location();
        Set<Element> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<List<Candidate>> passes = new ArrayList<>();
        for (String selector : profile.selectors()) {
            List<Candidate> pass = new ArrayList<>();
            for (Element element : select(document, selector)) {
                if (!seen.add(element)) {
                    continue;
                }
                if (profile.excludedAncestor() != null && element.closest(profile.excludedAncestor()) != null) {
                    continue;
                }
                toCandidate(element, base, profile).ifPresent(pass::add);
            }
            passes.add(List.copyOf(pass));
        }
        return passes;
    }

    private List<Element> select(Document document, String selector) {
        try {
            return document.select(selector);
        } catch (Selector.SelectorParseException e) {
            LOGGER.log(Level.WARNING, "Skipping unparseable selector " + selector, e);
            return List.of();
        }
    }

    private Optional<Candidate> toCandidate(Element element, String base, SourceProfile profile) {
        Element anchor = element.is("a[href]") ? element : element.selectFirst("a[href]");
        if (anchor == null) {
            anchor = element.closest("a[href]");
        }
        if (anchor == null) {
            return Optional.empty();
        }
        String url = TextUtils.absolutize(base, anchor.attr("href"));
        if (url == null) {
            return Optional.empty();
        }
        String title = title(element, anchor, profile);
        String imageUrl = image(element, base, profile);

        Map<String, Object> signals = new LinkedHashMap<>();
        signals.put(HAS_IMAGE, imageUrl != null);
        signals.put(HAS_HEADING, element.is(HEADINGS) || element.selectFirst(HEADINGS) != null
                || element.closest(HEADINGS) != null);
        signals.put(HAS_H1, element.is("h1") || element.selectFirst("h1") != null || element.closest("h1") != null);
        signals.put(IN_MAIN, element.closest("main") != null);
        signals.put(TITLE_LENGTH, title.length());
        for (SignalDefinition definition : profile.signals()) {
            signals.put(definition.name(), evaluate(definition, element, url, title));
        }
        return Optional.of(new Candidate(title, url, imageUrl, signals));
    }

    private String title(Element element, Element anchor, SourceProfile profile) {
        String title = "";
        for (String titleSelector : profile.titleSelectors()) {
            Element match = element.selectFirst(titleSelector);
            if (match != null) {
                title = TextUtils.cleanText(match.text());
                if (!title.isEmpty()) {
                    break;
                }
            }
        }
        if (title.isEmpty()) {
            title = TextUtils.cleanText(anchor.attr("aria-label"));
        }
        if (title.isEmpty()) {
            title = TextUtils.cleanText(element.text());
        }
        if (profile.titleSuffixPattern() != null && !profile.titleSuffixPattern().isBlank()) {
            title = TextUtils.cleanText(
                    Pattern.compile(profile.titleSuffixPattern(), Pattern.CASE_INSENSITIVE).matcher(title).replaceAll("")
            );
        }
        return title;
    }

    private String image(Element element, String base, SourceProfile profile) {
        Element scope = null;
        for (String scopeSelector : profile.imageScopes()) {
            scope = element.closest(scopeSelector);
            if (scope != null) {
                break;
            }
        }
        if (scope == null) {
            scope = element;
        }
        Element img = scope.selectFirst("img[src], img[srcset], img[data-src], source[srcset]");
        if (img == null) {
            return null;
        }
        String raw = TextUtils.bestFromSrcset(img.attr("srcset"));
        if (raw == null && !img.attr("src").isBlank() && !img.attr("src").startsWith("data:")) {
            raw = img.attr("src");
        }
        if (raw == null && !img.attr("data-src").isBlank()) {
            raw = img.attr("data-src");
        }
        return raw == null ? null : TextUtils.absolutize(base, raw);
    }

    private boolean evaluate(SignalDefinition definition, Element element, String url, String title) {
        return switch (definition.kind()) {
            case URL -> Pattern.compile(definition.pattern(), Pattern.CASE_INSENSITIVE).matcher(url).find();
            case TITLE -> Pattern.compile(definition.pattern(), Pattern.CASE_INSENSITIVE).matcher(title).find();
            case ANCESTOR -> element.parent() != null && element.parent().closest(definition.pattern()) != null;
            case DESCENDANT -> element.selectFirst(definition.pattern()) != null;
        };
    }
}
