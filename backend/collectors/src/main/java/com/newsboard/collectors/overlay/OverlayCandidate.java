package com.newsboard.collectors.overlay;

public record OverlayCandidate(
        String handle,
        String position,
        int zIndex,
        double width,
        double height,
        String role,
        String className,
        String elementId,
        String text
) {
    public double area() {
        return Math.max(0, width) * Math.max(0, height);
    }
}
