/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.eventlog.store;

/**
 * How an append treats the aggregate's current version.
 * <ul>
 *   <li>{@link #any()} - no check, the write is accepted whatever the current
 *       version is (last writer wins). This is the default.</li>
 *   <li>{@link #noStream()} - the aggregate must have no events yet.</li>
 *   <li>{@link #exactly(long)} - the aggregate must be at exactly that version.</li>
 * </ul>
 */
public final class ExpectedVersion {

    private static final long ANY_VALUE = -1L;

    private static final ExpectedVersion ANY = new ExpectedVersion(ANY_VALUE);
    private static final ExpectedVersion NO_STREAM = new ExpectedVersion(0L);

    private final long value;

    private ExpectedVersion(long value) {
        this.value = value;
    }

    public static ExpectedVersion any() {
        return ANY;
    }

    public static ExpectedVersion noStream() {
        return NO_STREAM;
    }

    /**
     * @param version the version the aggregate must be at, 0 for a new aggregate
     * @throws IllegalArgumentException if {@code version} is negative
     */
    public static ExpectedVersion exactly(long version) {
        if (version < 0) {
            throw new IllegalArgumentException("expected version must be >= 0, got " + version);
        }
        return version == 0 ? NO_STREAM : new ExpectedVersion(version);
    }

    public boolean isAny() {
        return value == ANY_VALUE;
    }

    /**
     * The required version.
     *
     * @throws IllegalStateException for {@link #any()}
     */
    public long value() {
        if (isAny()) {
            throw new IllegalStateException("ExpectedVersion.any() has no value");
        }
        return value;
    }

    public boolean matches(long currentVersion) {
        return isAny() || value == currentVersion;
    }

    /**
     * @throws ConcurrencyException if {@code currentVersion} does not match
     */
    void verify(String aggregateId, long currentVersion) {
        if (!matches(currentVersion)) {
            throw new ConcurrencyException(aggregateId, value, currentVersion);
        }
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ExpectedVersion && ((ExpectedVersion) o).value == value);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return isAny() ? "ExpectedVersion.any" : "ExpectedVersion(" + value + ")";
    }
}
