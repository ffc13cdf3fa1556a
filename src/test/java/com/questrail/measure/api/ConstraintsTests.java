package com.questrail.measure.api;

import com.questrail.measure.codec.ConstraintBounds;
import com.questrail.measure.codec.InvalidBoundsException;
import com.questrail.measure.codec.MagnitudeOverflowException;
import com.questrail.measure.codec.PackingScheme;
import com.questrail.measure.codec.SchemeUnsatisfiableException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static com.questrail.measure.api.Constraints.INFINITY;
import static org.junit.jupiter.api.Assertions.*;

class ConstraintsTests {

    @Test
    void accessorsReadEachBound() {
        Constraints c = Constraints.of(1, 2, 3, 4);

        assertEquals(1, c.minWidth());
        assertEquals(2, c.maxWidth());
        assertEquals(3, c.minHeight());
        assertEquals(4, c.maxHeight());
        assertEquals(new ConstraintBounds(1, 2, 3, 4), c.bounds());
    }

    @Test
    void fixedWidthLeavesHeightUnbounded() {
        Constraints c = Constraints.fixedWidth(64);

        assertEquals(new ConstraintBounds(64, 64, 0, INFINITY), c.bounds());
        assertTrue(c.hasFixedWidth());
        assertFalse(c.hasFixedHeight());
        assertTrue(c.hasBoundedWidth());
        assertFalse(c.hasBoundedHeight());
    }

    @Test
    void fixedHeightLeavesWidthUnbounded() {
        Constraints c = Constraints.fixedHeight(48);

        assertEquals(new ConstraintBounds(0, INFINITY, 48, 48), c.bounds());
        assertFalse(c.hasFixedWidth());
        assertTrue(c.hasFixedHeight());
    }

    @Test
    void fixedRejectsNegativeSizes() {
        assertThrows(InvalidBoundsException.class, () -> Constraints.fixed(-1, 10));
        assertThrows(InvalidBoundsException.class, () -> Constraints.fixedWidth(-5));
        assertThrows(InvalidBoundsException.class, () -> Constraints.fixedHeight(-5));
    }

    @Test
    void isZeroWhenEitherMaxIsZero() {
        assertTrue(Constraints.of(0, 0, 0, INFINITY).isZero());
        assertTrue(Constraints.fixed(100, 0).isZero());
        assertFalse(Constraints.unbounded().isZero());
        assertFalse(Constraints.fixed(1, 1).isZero());
    }

    @Test
    void equalBoundsAreEqualValues() {
        Constraints a = Constraints.of(10, 40_000, 0, 100);
        Constraints b = Constraints.fixed(10, 100).toBuilder().maxWidth(40_000).minHeight(0).build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(a.packedValue(), b.packedValue());
        assertNotEquals(a, Constraints.of(10, 40_000, 0, 101));
    }

    @Test
    void usableAsMapKey() {
        Map<Constraints, String> cache = new HashMap<>();
        cache.put(Constraints.fixed(320, 240), "thumbnail");

        assertEquals("thumbnail", cache.get(Constraints.of(320, 320, 240, 240)));
    }

    @Test
    void schemeFollowsWidthMagnitude() {
        assertEquals(PackingScheme.MAX_FOCUS_HEIGHT, Constraints.fixed(100, 100).scheme());
        assertEquals(PackingScheme.MAX_FOCUS_WIDTH, Constraints.fixed(100_000, 100).scheme());
    }

    @Test
    void builderReplacesOnlyGivenBounds() {
        Constraints base = Constraints.fixed(10, 20);

        Constraints widened = base.toBuilder().maxWidth(INFINITY).build();

        assertEquals(new ConstraintBounds(10, INFINITY, 20, 20), widened.bounds());
        assertEquals(Constraints.fixed(10, 20), base);
    }

    @Test
    void builderDefaultsToUnbounded() {
        assertEquals(Constraints.unbounded(), new Constraints.Builder().build());
        assertEquals(Constraints.fixedWidth(30), new Constraints.Builder().minWidth(30).maxWidth(30).build());
    }

    @Test
    void builderRevalidates() {
        Constraints base = Constraints.of(10, 50, 0, INFINITY);

        assertThrows(InvalidBoundsException.class, () -> base.toBuilder().maxWidth(5).build());
        assertThrows(InvalidBoundsException.class, () -> base.toBuilder().minHeight(-1).build());
        assertThrows(MagnitudeOverflowException.class, () -> base.toBuilder().maxWidth(1_000_000).build());
    }

    @Test
    void copyReplacesAllBounds() {
        Constraints copy = Constraints.unbounded().copy(1, 2, 3, 4);
        assertEquals(Constraints.of(1, 2, 3, 4), copy);
        assertThrows(InvalidBoundsException.class, () -> copy.copy(5, 4, 3, 4));
    }

    @Test
    void copyMayMoveToDifferentScheme() {
        Constraints small = Constraints.of(0, 100, 0, 100_000);
        Constraints wide = small.copy(0, 100_000, 0, 100);

        assertEquals(PackingScheme.MAX_FOCUS_HEIGHT, small.scheme());
        assertEquals(PackingScheme.MAX_FOCUS_WIDTH, wide.scheme());
        assertEquals(new ConstraintBounds(0, 100_000, 0, 100), wide.bounds());
    }

    @Test
    void enforceCoercesIntoOther() {
        Constraints c = Constraints.of(10, 200, 20, INFINITY);
        Constraints parent = Constraints.of(50, 100, 0, 30);

        Constraints enforced = c.enforce(parent);

        assertEquals(Constraints.of(50, 100, 20, 30), enforced);
        assertTrue(parent.satisfiedBy(IntSize.of(enforced.minWidth(), enforced.minHeight())));
        assertTrue(parent.satisfiedBy(IntSize.of(enforced.maxWidth(), enforced.maxHeight())));
    }

    @Test
    void enforceKeepsInfinityWhenOtherIsUnbounded() {
        Constraints c = Constraints.fixedHeight(40);
        assertEquals(c, c.enforce(Constraints.unbounded()));
    }

    @Test
    void enforceCanProduceBoundsThatDoNotPack() {
        Constraints wide = Constraints.of(0, 262_142, 0, 8_190);

        // the 18 bit width survives while height is pushed up to a 15 bit value
        assertThrows(SchemeUnsatisfiableException.class, () -> wide.enforce(Constraints.fixedHeight(8_191)));
    }

    @Test
    void constrainCoercesSize() {
        Constraints c = Constraints.of(10, 100, 20, INFINITY);

        assertEquals(IntSize.of(10, 1_000_000), c.constrain(IntSize.of(5, 1_000_000)));
        assertEquals(IntSize.of(100, 20), c.constrain(IntSize.of(200, 5)));
        assertEquals(IntSize.of(50, 60), c.constrain(IntSize.of(50, 60)));
    }

    @Test
    void satisfiedByIsInclusive() {
        Constraints c = Constraints.of(10, 100, 20, 30);

        assertTrue(c.satisfiedBy(IntSize.of(10, 20)));
        assertTrue(c.satisfiedBy(IntSize.of(100, 30)));
        assertFalse(c.satisfiedBy(IntSize.of(101, 30)));
        assertFalse(c.satisfiedBy(IntSize.of(50, 19)));
    }

    @Test
    void offsetTranslatesBounds() {
        Constraints c = Constraints.of(0, 100, 10, INFINITY);

        assertEquals(Constraints.of(10, 110, 15, INFINITY), c.offset(10, 5));
        assertEquals(Constraints.of(0, 50, 0, INFINITY), c.offset(-50, -20));
    }

    @Test
    void offsetPastWidestTierOverflows() {
        Constraints c = Constraints.fixed(262_000, 0);

        assertThrows(MagnitudeOverflowException.class, () -> c.offset(1_000, 0));
        assertThrows(MagnitudeOverflowException.class, () -> c.offset(Integer.MAX_VALUE, 0));
    }

    @Test
    void nullArgumentsRejected() {
        Constraints c = Constraints.unbounded();
        assertThrows(NullPointerException.class, () -> c.enforce(null));
        assertThrows(NullPointerException.class, () -> c.constrain(null));
        assertThrows(NullPointerException.class, () -> c.satisfiedBy(null));
    }

    @Test
    void toStringNamesInfinity() {
        assertEquals("Constraints(minWidth = 5, maxWidth = Infinity, minHeight = 0, maxHeight = 7)",
                Constraints.of(5, INFINITY, 0, 7).toString());
    }
}
