package com.newsboard.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class TextUtilsTest {
    @Test
    void cleanTextCollapsesAllWhitespace() {
        assertEquals("Hello World", TextUtils.cleanText("\n  Hello  \t World \n"));
        assertEquals("", TextUtils.cleanText(null));
    }

    @Test
    void normalizeUrlStripsTrackingOnly() {
        assertEquals(
                "https://news.example/story?id=7#top",
                TextUtils.normalizeUrl("https://news.example/story?utm_source=fb&id=7&UTM_Medium=x&fbclid=abc#top")
        );
        assertEquals("https://news.example/story", TextUtils.normalizeUrl("https://news.example/story?utm_campaign=a"));
        assertEquals("https://news.example/story", TextUtils.normalizeUrl("https://news.example/story"));
        assertEquals("not a url %%", TextUtils.normalizeUrl("not a url %%"));
    }

    @Test
    void absolutizeResolvesRelativeLinks() {
        assertEquals("https://www.cbsnews.com/news/x/", TextUtils.absolutize("https://www.cbsnews.com/", "/news/x/"));
        assertEquals("https://other.example/a", TextUtils.absolutize("https://www.cbsnews.com/", "https://other.example/a"));
        assertNull(TextUtils.absolutize("https://www.cbsnews.com/", ""));
        assertNull(TextUtils.absolutize(null, "/relative"));
    }

    @Test
    void srcsetPicksWidestCandidate() {
        assertEquals("/big.jpg", TextUtils.bestFromSrcset("/small.jpg 320w, /big.jpg 1280w, /mid.jpg 640w"));
        assertEquals("/b.jpg", TextUtils.bestFromSrcset("/a.jpg, /b.jpg"));
        assertNull(TextUtils.bestFromSrcset(" "));
    }

    @Test
    void truncateAddsEllipsis() {
        assertEquals("abcd…", TextUtils.truncate("abcdefgh", 5));
        assertEquals("abc", TextUtils.truncate("abc", 5));
    }
}
