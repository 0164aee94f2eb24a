package ch.so.agi.gretllog.utils;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class LoggerNameFormatterTest {

    @Test
    void shortNamesAreUnchanged() {
        assertEquals("orders", LoggerNameFormatter.abbreviate("orders", 20));
        assertEquals("a.b.C", LoggerNameFormatter.abbreviate("a.b.C", 5));
    }

    @Test
    void packagesAreReducedToInitials() {
        assertEquals("c.e.s.OrderService", LoggerNameFormatter.abbreviate("com.example.service.OrderService", 20));
    }

    @Test
    void longLastSegmentIsTruncated() {
        assertEquals("c.e.VeryLongClass...", LoggerNameFormatter.abbreviate("com.example.VeryLongClassNameHere", 20));
    }

    @Test
    void singleSegmentIsTruncated() {
        assertEquals("abcdefg...", LoggerNameFormatter.abbreviate("abcdefghijklmnop", 10));
        assertEquals("...", LoggerNameFormatter.abbreviate("abcdefghijklmnop", 2));
    }

    @Test
    void nullAndEmptyGiveEmptyString() {
        assertEquals("", LoggerNameFormatter.abbreviate(null, 10));
        assertEquals("", LoggerNameFormatter.abbreviate("", 10));
    }
}
