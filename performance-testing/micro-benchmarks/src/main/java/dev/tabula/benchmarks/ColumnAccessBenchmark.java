/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.tabula.benchmarks;

import java.util.Arrays;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import dev.tabula.frame.AccessOperators;
import dev.tabula.frame.Frame;
import dev.tabula.frame.RowSelector;
import dev.tabula.metadata.Policy;
import dev.tabula.schema.ColumnKey;
import dev.tabula.schema.ResolverOptions;
import dev.tabula.vector.ColumnVector;

/**
 * Benchmark for column access on wide frames, comparing exact lookups, legacy prefix
 * lookups and subsetting under both policies.
 *
 * <p>Run with:</p>
 * <pre>
 * java -jar benchmarks.jar ColumnAccessBenchmark
 * </pre>
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 2, jvmArgs = { "-Xms512m", "-Xmx512m" })
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class ColumnAccessBenchmark {

    @Param({ "16", "256", "4096" })
    private int columns;

    @Param({ "LEGACY", "STRICT" })
    private Policy policy;

    private Frame frame;
    private AccessOperators operators;
    private String[] exactNames;
    private String[] prefixes;
    private int[] positions;

    @Setup
    public void setup() {
        Random random = new Random(42);
        Frame.Builder builder = Frame.builder(policy);
        exactNames = new String[columns];
        prefixes = new String[columns];
        for (int i = 0; i < columns; i++) {
            String name = "column_" + Integer.toHexString(i) + "_x";
            builder.add(name, ColumnVector.ofDoubles(random.nextDouble(), random.nextDouble()));
            exactNames[i] = name;
            prefixes[i] = name.substring(0, name.length() - 1);
        }
        frame = builder.build();
        operators = AccessOperators.create(ResolverOptions.defaults());

        positions = new int[Math.min(columns, 8)];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = random.nextInt(columns);
        }
        positions = Arrays.stream(positions).distinct().toArray();
    }

    @Benchmark
    public void exactNameAccess(Blackhole bh) {
        for (String name : exactNames) {
            bh.consume(operators.nameAccess(frame, name));
        }
    }

    @Benchmark
    public void prefixNameAccess(Blackhole bh) {
        for (String prefix : prefixes) {
            bh.consume(operators.nameAccess(frame, prefix));
        }
    }

    @Benchmark
    public void selectPositions(Blackhole bh) {
        bh.consume(operators.select(frame, ColumnKey.positions(positions)));
    }

    @Benchmark
    public void selectRowsAndColumn(Blackhole bh) {
        bh.consume(operators.select(frame, RowSelector.of(1, 0), ColumnKey.position(positions[0])));
    }
}
