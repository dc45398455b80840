/*******************************************************************************
 *     ___                  _   ____  ____
 *    / _ \ _   _  ___  ___| |_|  _ \| __ )
 *   | | | | | | |/ _ \/ __| __| | | |  _ \
 *   | |_| | |_| |  __/\__ \ |_| |_| | |_) |
 *    \__\_\\__,_|\___||___/\__|____/|____/
 *
 *  Copyright (c) 2014-2019 Appsicle
 *  Copyright (c) 2019-2026 QuestDB
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 *
 ******************************************************************************/

package io.hugenumber.bench;

import io.hugenumber.std.HugeNumber;
import io.hugenumber.std.fmt.HugeNumberFormat;
import io.hugenumber.std.fmt.HugeNumberFormatter;
import io.hugenumber.std.fmt.HugeNumberParser;
import io.hugenumber.std.fmt.NumberStyles;
import io.hugenumber.std.str.StringSink;
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
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.math.BigDecimal;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 5, time = 100, timeUnit = TimeUnit.MILLISECONDS)
@Measurement(iterations = 5, time = 100, timeUnit = TimeUnit.MILLISECONDS)
@Fork(1)
@State(Scope.Thread)
public class HugeNumberParseFormatBenchmark {
    private final StringSink sink = new StringSink();
    @Param({"42", "-1,234,567.891", "2.4e42", "1.23456789012345678e-30000", "1/3"})
    private String text;
    private HugeNumber value;

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(HugeNumberParseFormatBenchmark.class.getSimpleName())
                .warmupIterations(5)
                .measurementIterations(10)
                .forks(1)
                .build();

        new Runner(opt).run();
    }

    @Benchmark
    public BigDecimal bigDecimalParse() {
        return value.isRational() ? null : new BigDecimal(text.replace(",", ""));
    }

    @Benchmark
    public CharSequence format() {
        sink.clear();
        HugeNumberFormatter.format(sink, value, HugeNumberFormatter.GENERAL, HugeNumberFormat.INVARIANT);
        return sink;
    }

    @Benchmark
    public CharSequence formatNumber() {
        sink.clear();
        HugeNumberFormatter.format(sink, value, "N2", HugeNumberFormat.INVARIANT);
        return sink;
    }

    @Benchmark
    public HugeNumber parse() {
        return HugeNumberParser.parse(text, 0, text.length(), NumberStyles.ANY, HugeNumberFormat.INVARIANT);
    }

    @Setup
    public void setup() {
        value = HugeNumber.parse(text);
    }
}
