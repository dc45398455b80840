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

import io.hugenumber.std.DivRem;
import io.hugenumber.std.HugeNumber;
import io.hugenumber.std.Rnd;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
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
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 5, time = 100, timeUnit = TimeUnit.MILLISECONDS)
@Measurement(iterations = 5, time = 100, timeUnit = TimeUnit.MILLISECONDS)
@Fork(1)
@State(Scope.Thread)
public class HugeNumberDivideBenchmark {
    private static final int N = 1024;
    private static final int MASK = N - 1;
    private final HugeNumber[] dividends = new HugeNumber[N];
    private final HugeNumber[] divisors = new HugeNumber[N];
    private int index;

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(HugeNumberDivideBenchmark.class.getSimpleName())
                .warmupIterations(3)
                .measurementIterations(5)
                .forks(1)
                .build();

        new Runner(opt).run();
    }

    @Benchmark
    public HugeNumber divide() {
        final int i = index++ & MASK;
        return HugeNumber.divide(dividends[i], divisors[i]);
    }

    @Benchmark
    public DivRem divRem() {
        final int i = index++ & MASK;
        return HugeNumber.divRem(dividends[i], divisors[i]);
    }

    @Benchmark
    public HugeNumber ieeeRemainder() {
        final int i = index++ & MASK;
        return HugeNumber.ieeeRemainder(dividends[i], divisors[i]);
    }

    @Benchmark
    public HugeNumber mod() {
        final int i = index++ & MASK;
        return HugeNumber.mod(dividends[i], divisors[i]);
    }

    @Setup
    public void setup() {
        Rnd rnd = new Rnd();
        for (int i = 0; i < N; i++) {
            dividends[i] = rnd.nextHugeNumber(30);
            divisors[i] = rnd.nextHugeNumber(10);
        }
    }
}
