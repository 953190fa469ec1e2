package li.cil.datamodels.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public final class CTypeTests {
    @Test
    public void keywordsAreCSpellings() {
        assertEquals("char", CType.CHAR.keyword());
        assertEquals("short", CType.SHORT.keyword());
        assertEquals("int", CType.INT.keyword());
        assertEquals("long", CType.LONG.keyword());
        assertEquals("long long", CType.LONG_LONG.keyword());
        assertEquals("void *", CType.POINTER.keyword());
    }

    @Test
    public void minimumWidthsFollowStandard() {
        assertEquals(8, CType.CHAR.minimumBits());
        assertEquals(16, CType.SHORT.minimumBits());
        assertEquals(16, CType.INT.minimumBits());
        assertEquals(32, CType.LONG.minimumBits());
        assertEquals(64, CType.LONG_LONG.minimumBits());
        assertEquals(16, CType.POINTER.minimumBits());
    }

    @Test
    public void everyKeywordLooksUpItsType() {
        for (final CType type : CType.values()) {
            assertEquals(type, CType.byKeyword(type.keyword()).orElseThrow());
        }
    }

    @Test
    public void whitespaceIsNormalized() {
        assertEquals(CType.LONG_LONG, CType.byKeyword("long   long").orElseThrow());
        assertEquals(CType.LONG_LONG, CType.byKeyword(" long\tlong ").orElseThrow());
        assertEquals(CType.POINTER, CType.byKeyword("void*").orElseThrow());
        assertEquals(CType.POINTER, CType.byKeyword("void  *").orElseThrow());
    }

    @Test
    public void unknownKeywordsAreEmpty() {
        assertTrue(CType.byKeyword("long double").isEmpty());
        assertTrue(CType.byKeyword("wchar_t").isEmpty());
        assertTrue(CType.byKeyword("").isEmpty());
        assertTrue(CType.byKeyword(null).isEmpty());
    }
}
