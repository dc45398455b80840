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

import io.hugenumber.std.HugeMath;
import io.hugenumber.std.HugeNumber;
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

import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 3, time = 200, timeUnit = TimeUnit.MILLISECONDS)
@Measurement(iterations = 5, time = 200, timeUnit = TimeUnit.MILLISECONDS)
@Fork(1)
@State(Scope.Benchmark)
public class HugeMathBenchmark {
    private HugeNumber exponent;
    @Param({"0.5", "2.718281828", "12345.678", "1e300"})
    private String input;
    private HugeNumber value;

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(HugeMathBenchmark.class.getSimpleName())
                .build();

        new Runner(opt).run();
    }

    @Benchmark
    public HugeNumber exp() {
        return HugeMath.exp(HugeMath.log(value));
    }

    @Benchmark
    public HugeNumber log() {
        return HugeMath.log(value);
    }

    @Benchmark
    public HugeNumber log10() {
        return HugeMath.log10(value);
    }

    @Benchmark
    public HugeNumber powFractional() {
        return HugeMath.pow(value, exponent);
    }

    @Benchmark
    public HugeNumber powInteger() {
        return HugeMath.pow(value, HugeNumber.of(7));
    }

    @Benchmark
    public HugeNumber sqrt() {
        return HugeMath.sqrt(value);
    }

    @Setup
    public void setup() {
        value = HugeNumber.parse(input);
        exponent = HugeNumber.of(15, -1);
    }
}
