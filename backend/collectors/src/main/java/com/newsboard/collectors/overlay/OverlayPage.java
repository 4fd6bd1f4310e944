package com.newsboard.collectors.overlay;

import java.util.List;
import java.util.regex.Pattern;

public interface OverlayPage extends OverlayScope {
    void pressKey(String key);

    List<OverlayScope> framesMatching(Pattern urlPattern);

    Viewport viewport();

    List<OverlayCandidate> positionedElements();

    int remove(List<OverlayCandidate> elements);
}
