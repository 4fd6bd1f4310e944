package com.newsboard.collectors.overlay;

public record Viewport(int width, int height) {
    public double area() {
        return (double) width * height;
    }
}
