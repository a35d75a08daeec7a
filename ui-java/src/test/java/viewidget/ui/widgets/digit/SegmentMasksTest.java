package viewidget.ui.widgets.digit;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class SegmentMasksTest {

    @Test
    void acceptsIntegersAndHexCharacters() {
        assertEquals(0, SegmentMasks.glyphOf(0));
        assertEquals(15, SegmentMasks.glyphOf(15L));
        assertEquals(7, SegmentMasks.glyphOf("7"));
        assertEquals(10, SegmentMasks.glyphOf("a"));
        assertEquals(11, SegmentMasks.glyphOf('B'));
        assertEquals(4, SegmentMasks.glyphOf(4.0));
    }

    @Test
    void rejectsEverythingElse() {
        assertEquals(-1, SegmentMasks.glyphOf(16));
        assertEquals(-1, SegmentMasks.glyphOf(-1));
        assertEquals(-1, SegmentMasks.glyphOf(2.5));
        assertEquals(-1, SegmentMasks.glyphOf("10"));
        assertEquals(-1, SegmentMasks.glyphOf("g"));
        assertEquals(-1, SegmentMasks.glyphOf(""));
        assertEquals(-1, SegmentMasks.glyphOf('٣'));
        assertEquals(-1, SegmentMasks.glyphOf(new Object()));
    }

    @Test
    void glyphMasks() {
        assertEquals(SegmentMasks.ALL, SegmentMasks.mask(8));
        // 1 lights only the right-hand verticals
        assertEquals((1 << 3) | (1 << 5), SegmentMasks.mask(1));
        // 0 lights everything but the middle
        assertEquals(SegmentMasks.ALL & ~(1 << 6), SegmentMasks.mask(0));
    }

    @Test
    void charOfIsUpperCaseHex() {
        assertEquals('B', SegmentMasks.charOf(11));
        assertEquals('3', SegmentMasks.charOf(3));
    }

    @Test
    void describePadsToSevenBits() {
        assertEquals("0b0101000", SegmentMasks.describe(SegmentMasks.mask(1)));
    }
}
