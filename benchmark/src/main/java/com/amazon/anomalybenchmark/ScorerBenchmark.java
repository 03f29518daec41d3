/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.anomalybenchmark;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.amazon.anomalybenchmark.config.CostMatrix;
import com.amazon.anomalybenchmark.returntypes.ScoreResult;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(value = 1)
@State(Scope.Thread)
public class ScorerBenchmark {

    public final static int NUMBER_OF_ANOMALIES = 10;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({"1000", "10000", "100000"})
        int dataSize;

        @Param({"0.01", "0.05"})
        double detectionRate;

        List<LocalDateTime> timestamps;
        List<LocalDateTime> trueAnomalies;
        int[] predictions;
        Labeler labeler;
        List<WindowLimit> windows;

        @Setup(Level.Trial)
        public void setUpData() {
            Random random = new Random(99);
            LocalDateTime start = LocalDateTime.of(2020, 1, 1, 0, 0);
            timestamps = new ArrayList<>(dataSize);
            for (int i = 0; i < dataSize; i++) {
                timestamps.add(start.plusMinutes(5L * i));
            }

            trueAnomalies = new ArrayList<>(NUMBER_OF_ANOMALIES);
            for (int i = 1; i <= NUMBER_OF_ANOMALIES; i++) {
                trueAnomalies.add(timestamps.get(i * dataSize / (NUMBER_OF_ANOMALIES + 1)));
            }

            predictions = new int[dataSize];
            for (int i = 0; i < dataSize; i++) {
                predictions[i] = random.nextDouble() < detectionRate ? 1 : 0;
            }

            labeler = new Labeler(0.1, 0.15);
            labeler.setData(timestamps);
            labeler.setLabels(trueAnomalies);
            windows = labeler.getWindows();
        }
    }

    @Benchmark
    public List<WindowLimit> labelerGetWindows(BenchmarkState state) {
        return state.labeler.getWindows();
    }

    @Benchmark
    public ScoreResult scorerGetScore(BenchmarkState state) {
        Scorer scorer = Scorer.builder()
                .timestamps(state.timestamps)
                .predictions(state.predictions)
                .labels(state.labeler.getLabels())
                .windowLimits(state.windows)
                .costMatrix(new CostMatrix(1.0, 0.11, 1.0, 1.0))
                .probationaryPeriod(CommonUtils.getProbationPeriod(0.15, state.dataSize))
                .build();
        return scorer.getScore();
    }

    @Benchmark
    public void scorerNormalizeScore(BenchmarkState state, Blackhole blackhole) {
        Scorer scorer = Scorer.builder()
                .timestamps(state.timestamps)
                .predictions(state.predictions)
                .labels(state.labeler.getLabels())
                .windowLimits(state.windows)
                .costMatrix(new CostMatrix(1.0, 0.11, 1.0, 1.0))
                .build();
        blackhole.consume(scorer.getScore());
        blackhole.consume(scorer.normalizeScore());
    }
}
