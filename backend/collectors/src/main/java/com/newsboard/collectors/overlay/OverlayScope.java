package com.newsboard.collectors.overlay;

import java.time.Duration;
import java.util.regex.Pattern;

public interface OverlayScope {
    boolean clickButtonNamed(Pattern name, Duration visibleTimeout, Duration clickTimeout);

    boolean clickFirstVisible(String selector, Duration visibleTimeout, Duration clickTimeout);
}
