package com.mesosphere.master.offer;

import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.apache.mesos.Protos.Value.Range;

import java.util.ArrayList;
import java.util.List;

/**
 * Interval arithmetic over Mesos {@link Range} lists, as used by RANGES resources such as ports.
 */
public final class RangeAlgorithms {

    private RangeAlgorithms() {
        // do not instantiate
    }

    /**
     * Combines and flattens the provided sets of ranges into a unified set.
     */
    public static List<Range> mergeRanges(List<Range> r1, List<Range> r2) {
        List<Interval> intervals = rangesToIntervals(r1);
        intervals.addAll(rangesToIntervals(r2));
        return intervalSetToRanges(intervalsToIntervalSet(intervals));
    }

    /**
     * Removes the range intervals listed in {@code subtrahend} from {@code minuend}.
     */
    public static List<Range> subtractRanges(List<Range> minuend, List<Range> subtrahend) {
        IntervalSet iMinuend = intervalsToIntervalSet(rangesToIntervals(minuend));
        IntervalSet iSubtrahend = intervalsToIntervalSet(rangesToIntervals(subtrahend));
        return intervalSetToRanges(IntervalSet.subtract(iMinuend, iSubtrahend));
    }

    /**
     * Returns whether every value covered by {@code subset} is also covered by {@code superset}.
     */
    public static boolean rangesContain(List<Range> superset, List<Range> subset) {
        return subtractRanges(subset, superset).isEmpty();
    }

    private static List<Interval> rangesToIntervals(List<Range> ranges) {
        List<Interval> intervals = new ArrayList<>();
        for (Range range : ranges) {
            intervals.add(Interval.of((int) range.getBegin(), (int) range.getEnd()));
        }
        return intervals;
    }

    private static IntervalSet intervalsToIntervalSet(List<Interval> intervals) {
        IntervalSet intervalSet = new IntervalSet();
        for (Interval interval : intervals) {
            intervalSet.add(interval.a, interval.b);
        }
        return intervalSet;
    }

    private static List<Range> intervalSetToRanges(IntervalSet intervalSet) {
        List<Range> ranges = new ArrayList<>();
        if (intervalSet.isNil()) {
            return ranges;
        }
        for (Interval interval : intervalSet.getIntervals()) {
            ranges.add(Range.newBuilder().setBegin(interval.a).setEnd(interval.b).build());
        }
        return ranges;
    }
}
