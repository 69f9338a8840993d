/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.snitch.config;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static java.util.concurrent.TimeUnit.DAYS;
import static java.util.concurrent.TimeUnit.HOURS;
import static java.util.concurrent.TimeUnit.MICROSECONDS;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.MINUTES;
import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Represents a positive time duration. Wrapper class for duration configuration parameters, letting
 * users write the value with a unit of their choice in snitch.yaml, e.g. {@code 10m} or {@code 600000ms}.
 */
public abstract class DurationSpec
{
    /**
     * The Regexp used to parse the duration provided as String.
     */
    private static final Pattern UNITS_PATTERN = Pattern.compile("^(\\d+)(d|h|s|ms|us|µs|ns|m)$");

    private final long quantity;

    private final TimeUnit unit;

    private DurationSpec(long quantity, TimeUnit unit, TimeUnit minUnit, long max)
    {
        this.quantity = quantity;
        this.unit = unit;

        validateMinUnit(unit, minUnit, quantity + " " + unit);
        validateQuantity(quantity, unit, minUnit, max);
    }

    private DurationSpec(String value, TimeUnit minUnit, long max)
    {
        Matcher matcher = UNITS_PATTERN.matcher(value);

        if (!matcher.find())
            throw new IllegalArgumentException("Invalid duration: " + value + " Accepted units:" + acceptedUnits(minUnit) +
                                               " where case matters and only non-negative values.");

        quantity = Long.parseLong(matcher.group(1));
        unit = fromSymbol(matcher.group(2));

        validateMinUnit(unit, minUnit, value);
        validateQuantity(value, quantity, unit, minUnit, max);
    }

    private static void validateMinUnit(TimeUnit unit, TimeUnit minUnit, String value)
    {
        if (unit.compareTo(minUnit) < 0)
            throw new IllegalArgumentException(String.format("Invalid duration: %s Accepted units:%s", value, acceptedUnits(minUnit)));
    }

    private static String acceptedUnits(TimeUnit minUnit)
    {
        TimeUnit[] units = TimeUnit.values();
        return Arrays.toString(Arrays.copyOfRange(units, minUnit.ordinal(), units.length));
    }

    private static void validateQuantity(String value, long quantity, TimeUnit sourceUnit, TimeUnit minUnit, long max)
    {
        // no need to validate for negatives as they are not allowed at first place from the regex

        if (minUnit.convert(quantity, sourceUnit) >= max)
            throw new IllegalArgumentException("Invalid duration: " + value + ". It shouldn't be more than " +
                                               (max - 1) + " in " + minUnit.name().toLowerCase());
    }

    private static void validateQuantity(long quantity, TimeUnit sourceUnit, TimeUnit minUnit, long max)
    {
        if (quantity < 0)
            throw new IllegalArgumentException("Invalid duration: value must be non-negative");

        if (minUnit.convert(quantity, sourceUnit) >= max)
            throw new IllegalArgumentException(String.format("Invalid duration: %d %s. It shouldn't be more than %d in %s",
                                                             quantity, sourceUnit.name().toLowerCase(),
                                                             max - 1, minUnit.name().toLowerCase()));
    }

    // get vs no-get prefix matters for classes involved with config parsing: with a getter SnakeYAML would
    // treat this data-type as a nested bean
    public long quantity()
    {
        return quantity;
    }

    public TimeUnit unit()
    {
        return unit;
    }

    /**
     * @param symbol the time unit symbol
     * @return the time unit associated to the specified symbol
     */
    static TimeUnit fromSymbol(String symbol)
    {
        switch (symbol.toLowerCase())
        {
            case "d": return DAYS;
            case "h": return HOURS;
            case "m": return MINUTES;
            case "s": return SECONDS;
            case "ms": return MILLISECONDS;
            case "us":
            case "µs": return MICROSECONDS;
            case "ns": return NANOSECONDS;
        }
        throw new IllegalArgumentException(String.format("Unsupported time unit: %s. Supported units are: %s",
                                                         symbol, Arrays.stream(TimeUnit.values())
                                                                       .map(DurationSpec::symbol)
                                                                       .collect(Collectors.joining(", "))));
    }

    /**
     * @param targetUnit the time unit
     * @return this duration in the specified time unit
     */
    public long to(TimeUnit targetUnit)
    {
        return targetUnit.convert(quantity, unit);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(unit.toMillis(quantity));
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj)
            return true;

        if (!(obj instanceof DurationSpec))
            return false;

        DurationSpec other = (DurationSpec) obj;
        if (unit == other.unit)
            return quantity == other.quantity;

        // Due to overflows we can only guarantee that the 2 durations are equal if we get the same results
        // doing the conversion in both directions.
        return unit.convert(other.quantity, other.unit) == quantity && other.unit.convert(quantity, unit) == other.quantity;
    }

    @Override
    public String toString()
    {
        return quantity + symbol(unit);
    }

    static String symbol(TimeUnit unit)
    {
        switch (unit)
        {
            case DAYS: return "d";
            case HOURS: return "h";
            case MINUTES: return "m";
            case SECONDS: return "s";
            case MILLISECONDS: return "ms";
            case MICROSECONDS: return "us";
            case NANOSECONDS: return "ns";
        }
        throw new AssertionError();
    }

    /**
     * Represents a duration used for configuration. The bound is [0, Integer.MAX_VALUE) in milliseconds.
     * If the user sets a different unit we still validate that, converted to milliseconds, the quantity
     * does not exceed that upper bound.
     */
    public final static class IntMillisecondsBound extends DurationSpec
    {
        /**
         * Creates a {@code DurationSpec.IntMillisecondsBound} of the specified amount.
         * The bound is [0, Integer.MAX_VALUE) in milliseconds.
         *
         * @param value the duration
         */
        public IntMillisecondsBound(String value)
        {
            super(value, MILLISECONDS, Integer.MAX_VALUE);
        }

        /**
         * Creates a {@code DurationSpec.IntMillisecondsBound} of the specified amount in the specified unit.
         * The bound is [0, Integer.MAX_VALUE) in milliseconds.
         *
         * @param quantity where quantity shouldn't be bigger than Integer.MAX_VALUE - 1 in milliseconds
         * @param unit in which the provided quantity is
         */
        public IntMillisecondsBound(long quantity, TimeUnit unit)
        {
            super(quantity, unit, MILLISECONDS, Integer.MAX_VALUE);
        }

        /**
         * Creates a {@code DurationSpec.IntMillisecondsBound} of the specified amount in milliseconds.
         *
         * @param milliseconds where milliseconds shouldn't be bigger than Integer.MAX_VALUE-1
         */
        public IntMillisecondsBound(long milliseconds)
        {
            this(milliseconds, MILLISECONDS);
        }

        /**
         * @return this duration in number of milliseconds
         */
        public int toMilliseconds()
        {
            return (int) unit().toMillis(quantity());
        }
    }
}
