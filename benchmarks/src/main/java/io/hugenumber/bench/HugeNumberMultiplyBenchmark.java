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
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 5, time = 100, timeUnit = TimeUnit.MILLISECONDS)
@Measurement(iterations = 5, time = 100, timeUnit = TimeUnit.MILLISECONDS)
@Fork(1)
@State(Scope.Benchmark)
public class HugeNumberMultiplyBenchmark {

    private BigDecimal bigDecimalFactor1;
    private BigDecimal bigDecimalFactor2;
    private HugeNumber hugeFactor1;
    private HugeNumber hugeFactor2;
    private MathContext mathContext;
    @SuppressWarnings("unused")
    @Param({"SIMPLE", "FULL_MANTISSA", "HUGE_EXPONENTS", "FRACTIONS"})
    private String scenario;

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(HugeNumberMultiplyBenchmark.class.getSimpleName())
                .warmupIterations(5)
                .measurementIterations(10)
                .forks(1)
                .build();

        new Runner(opt).run();
    }

    @Benchmark
    public BigDecimal bigDecimalMultiply() {
        return bigDecimalFactor1.multiply(bigDecimalFactor2, mathContext);
    }

    @Benchmark
    public HugeNumber hugeNumberMultiply() {
        return HugeNumber.multiply(hugeFactor1, hugeFactor2);
    }

    @Benchmark
    public HugeNumber hugeNumberSquare() {
        return HugeNumber.square(hugeFactor1);
    }

    @Setup
    public void setup() {
        mathContext = new MathContext(18, RoundingMode.HALF_EVEN);

        switch (scenario) {
            case "SIMPLE":
                // 123.456 * 7.89, exact in 64 bits
                hugeFactor1 = HugeNumber.of(123456, -3);
                hugeFactor2 = HugeNumber.of(789, -2);
                break;
            case "FULL_MANTISSA":
                // 18 digit operands, the product needs the wide path
                hugeFactor1 = HugeNumber.of(123456789012345678L, -9);
                hugeFactor2 = HugeNumber.of(987654321098765432L, -9);
                break;
            case "HUGE_EXPONENTS":
                // 2.5e20000 * 4e-19000
                hugeFactor1 = HugeNumber.of(25, 19999);
                hugeFactor2 = HugeNumber.of(4, -19000);
                break;
            case "FRACTIONS":
                // 1/3 * 5/7
                hugeFactor1 = HugeNumber.ofRational(1, 3);
                hugeFactor2 = HugeNumber.ofRational(5, 7);
                break;
            default:
                throw new IllegalArgumentException("Unknown scenario: " + scenario);
        }
        bigDecimalFactor1 = hugeFactor1.toBigDecimal();
        bigDecimalFactor2 = hugeFactor2.toBigDecimal();
    }
}
