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

package com.amazon.anomalybenchmark.runner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;
import java.util.StringJoiner;

import com.amazon.anomalybenchmark.DataSetScorer;
import com.amazon.anomalybenchmark.Labeler;
import com.amazon.anomalybenchmark.Record;
import com.amazon.anomalybenchmark.config.ScoringMode;
import com.amazon.anomalybenchmark.profile.IProfileLookup;
import com.amazon.anomalybenchmark.profile.JsonProfileLookup;
import com.amazon.anomalybenchmark.returntypes.ClassificationCounts;
import com.amazon.anomalybenchmark.returntypes.DataSetScore;

/**
 * Scores the output of a detector read from STDIN. Every input row holds a
 * timestamp, the anomaly score of the detector and a label, where a label of 1
 * marks a ground truth anomaly. Once the input ends, every row is written back
 * with the detection, the alert type and the score contribution appended,
 * followed by summary lines that start with '#'.
 */
public class ScoreRunner {

    public static final int TIMESTAMP_COLUMN = 0;
    public static final int ANOMALY_SCORE_COLUMN = 1;
    public static final int LABEL_COLUMN = 2;

    protected final ArgumentParser argumentParser;
    protected final IProfileLookup profiles;
    protected final List<String[]> rows = new ArrayList<>();
    protected final List<LocalDateTime> timestamps = new ArrayList<>();
    protected final List<LocalDateTime> trueAnomalies = new ArrayList<>();
    protected final List<Double> anomalyScores = new ArrayList<>();
    protected DateTimeFormatter formatter;
    protected String[] header;
    protected int lineNumber;

    public ScoreRunner(IProfileLookup profiles) {
        this(new ArgumentParser(ScoreRunner.class.getName(),
                "Score the anomaly scores of a detector against labeled anomalies."), profiles);
    }

    public ScoreRunner(ArgumentParser argumentParser, IProfileLookup profiles) {
        this.argumentParser = argumentParser;
        this.profiles = profiles;
    }

    public static void main(String... args) throws IOException {
        ScoreRunner runner = new ScoreRunner(JsonProfileLookup.fromDefaultResource());
        runner.parse(args);
        System.out.println("Reading from stdin... (Ctrl-c to exit)");
        runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        System.out.println("Done.");
    }

    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    public void run(BufferedReader in, PrintWriter out) throws IOException {
        formatter = DateTimeFormatter.ofPattern(argumentParser.getTimestampFormat());
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty()) {
                continue;
            }
            String[] values = line.split(argumentParser.getDelimiter());

            if (lineNumber == 1 && argumentParser.getHeaderRow()) {
                header = values;
                continue;
            }

            processLine(values);
        }

        finish(out);
        out.flush();
    }

    protected void processLine(String[] values) {
        if (values.length < 3) {
            throw new IllegalArgumentException(String.format(
                    "Wrong number of values on line %d. Expected at least 3 but found %d.", lineNumber,
                    values.length));
        }

        LocalDateTime timestamp;
        try {
            timestamp = LocalDateTime.parse(values[TIMESTAMP_COLUMN].trim(), formatter);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(String.format("Invalid timestamp on line %d", lineNumber), e);
        }
        timestamps.add(timestamp);
        anomalyScores.add(Double.parseDouble(values[ANOMALY_SCORE_COLUMN].trim()));
        if (Integer.parseInt(values[LABEL_COLUMN].trim()) != 0) {
            trueAnomalies.add(timestamp);
        }
        rows.add(values);
    }

    protected void finish(PrintWriter out) {
        ScoringMode mode = argumentParser.getFlatScoring() ? ScoringMode.FLAT : ScoringMode.SCALED_SIGMOID;
        DataSetScorer dataSetScorer = new DataSetScorer(profiles, mode);
        Labeler labeler = new Labeler(argumentParser.getWindowSize(), argumentParser.getProbationaryPercent());
        double[] scores = anomalyScores.stream().mapToDouble(Double::doubleValue).toArray();
        DataSetScore result = dataSetScorer.scoreDataSet(labeler, timestamps, trueAnomalies, scores,
                argumentParser.getThreshold(), argumentParser.getDetectorName(), argumentParser.getProfileName(),
                null);

        String delimiter = argumentParser.getDelimiter();
        if (header != null) {
            StringJoiner joiner = new StringJoiner(delimiter);
            Arrays.stream(header).forEach(joiner::add);
            joiner.add("detection").add("alert_type").add("score");
            out.println(joiner.toString());
        }

        int[] predictions = result.getScorer().getPredictions();
        double[] recordScores = result.getScorer().getScoreResult().getScores();
        List<Record> records = result.getScorer().getRecords();
        for (int i = 0; i < rows.size(); i++) {
            StringJoiner joiner = new StringJoiner(delimiter);
            Arrays.stream(rows.get(i)).forEach(joiner::add);
            joiner.add(Integer.toString(predictions[i]));
            joiner.add(records.get(i).getAlertType().getCode());
            joiner.add(Double.toString(recordScores[i]));
            out.println(joiner.toString());
        }

        ClassificationCounts counts = result.getCounts();
        out.println(String.format("# detector: %s, profile: %s", result.getDetectorName(), result.getProfileName()));
        out.println(String.format("# windows: %d", result.getScorer().getWindows().size()));
        out.println(String.format("# counts: tp=%d, fp=%d, tn=%d, fn=%d", counts.getTruePositives(),
                counts.getFalsePositives(), counts.getTrueNegatives(), counts.getFalseNegatives()));
        out.println(String.format("# score: %s", result.getScore()));
        if (argumentParser.getNormalize()) {
            OptionalDouble normalized = result.getScorer().normalizeScore();
            out.println("# normalized score: " + (normalized.isPresent() ? normalized.getAsDouble() : "NA"));
        }
    }
}
