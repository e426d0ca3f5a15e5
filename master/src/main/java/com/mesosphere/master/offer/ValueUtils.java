package com.mesosphere.master.offer;

import org.apache.mesos.Protos.Resource;
import org.apache.mesos.Protos.Value;
import org.apache.mesos.Protos.Value.Type;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Utilities for manipulating Value protobufs.
 */
public class ValueUtils {

    private ValueUtils() {
        // do not instantiate
    }

    public static Value getValue(Resource resource) {
        Type type = resource.getType();
        Value.Builder builder = Value.newBuilder();
        builder.setType(type);

        switch (type) {
            case SCALAR:
                return builder.setScalar(resource.getScalar()).build();
            case RANGES:
                return builder.setRanges(resource.getRanges()).build();
            case SET:
                return builder.setSet(resource.getSet()).build();
            default:
                throw new IllegalArgumentException("Unsupported resource value type: " + type);
        }
    }

    /**
     * Returns a copy of {@code resource} whose value has been replaced with {@code value}.
     */
    public static Resource withValue(Resource resource, Value value) {
        Resource.Builder builder = resource.toBuilder().clearScalar().clearRanges().clearSet();
        switch (value.getType()) {
            case SCALAR:
                return builder.setScalar(value.getScalar()).build();
            case RANGES:
                return builder.setRanges(value.getRanges()).build();
            case SET:
                return builder.setSet(value.getSet()).build();
            default:
                throw new IllegalArgumentException("Unsupported resource value type: " + value.getType());
        }
    }

    public static Value add(Value val1, Value val2) {
        checkSameType(val1, val2);

        switch (val1.getType()) {
            case SCALAR:
                return scalar(val1.getScalar().getValue() + val2.getScalar().getValue());
            case RANGES:
                return Value.newBuilder()
                        .setType(Type.RANGES)
                        .setRanges(Value.Ranges.newBuilder().addAllRange(RangeAlgorithms.mergeRanges(
                                val1.getRanges().getRangeList(), val2.getRanges().getRangeList())))
                        .build();
            case SET:
                Set<String> items = new LinkedHashSet<>(val1.getSet().getItemList());
                items.addAll(val2.getSet().getItemList());
                return set(items);
            default:
                throw new IllegalArgumentException("Unsupported value type: " + val1.getType());
        }
    }

    public static Value subtract(Value val1, Value val2) {
        checkSameType(val1, val2);

        switch (val1.getType()) {
            case SCALAR:
                return scalar(val1.getScalar().getValue() - val2.getScalar().getValue());
            case RANGES:
                return Value.newBuilder()
                        .setType(Type.RANGES)
                        .setRanges(Value.Ranges.newBuilder().addAllRange(RangeAlgorithms.subtractRanges(
                                val1.getRanges().getRangeList(), val2.getRanges().getRangeList())))
                        .build();
            case SET:
                Set<String> items = new LinkedHashSet<>(val1.getSet().getItemList());
                items.removeAll(val2.getSet().getItemList());
                return set(items);
            default:
                throw new IllegalArgumentException("Unsupported value type: " + val1.getType());
        }
    }

    /**
     * Returns whether {@code superset} holds at least everything held by {@code subset}.
     */
    public static boolean contains(Value superset, Value subset) {
        if (superset.getType() != subset.getType()) {
            return false;
        }

        switch (superset.getType()) {
            case SCALAR:
                return round(superset.getScalar().getValue()) >= round(subset.getScalar().getValue());
            case RANGES:
                return RangeAlgorithms.rangesContain(
                        superset.getRanges().getRangeList(), subset.getRanges().getRangeList());
            case SET:
                return superset.getSet().getItemList().containsAll(subset.getSet().getItemList());
            default:
                return false;
        }
    }

    /**
     * Returns whether the value holds nothing: a non-positive scalar, or no ranges or set items.
     */
    public static boolean isEmpty(Value value) {
        switch (value.getType()) {
            case SCALAR:
                return round(value.getScalar().getValue()) <= 0;
            case RANGES:
                return value.getRanges().getRangeCount() == 0;
            case SET:
                return value.getSet().getItemCount() == 0;
            default:
                return true;
        }
    }

    /**
     * Rounds a scalar to the fixed-point precision used for resource accounting.
     */
    public static double round(double value) {
        return BigDecimal.valueOf(value)
                .setScale(Constants.SCALAR_PRECISION_DIGITS, RoundingMode.HALF_EVEN)
                .doubleValue();
    }

    private static Value scalar(double value) {
        return Value.newBuilder()
                .setType(Type.SCALAR)
                .setScalar(Value.Scalar.newBuilder().setValue(round(value)))
                .build();
    }

    private static Value set(Set<String> items) {
        return Value.newBuilder()
                .setType(Type.SET)
                .setSet(Value.Set.newBuilder().addAllItem(items))
                .build();
    }

    private static void checkSameType(Value val1, Value val2) {
        if (val1.getType() != val2.getType()) {
            throw new IllegalArgumentException(String.format(
                    "Mismatched value types: %s vs %s", val1.getType(), val2.getType()));
        }
    }
}
