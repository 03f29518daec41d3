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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ArgumentParserTest {

    private ArgumentParser parser;

    @BeforeEach
    public void setUp() {
        parser = new ArgumentParser("runner-class", "runner-description");
    }

    @Test
    public void testNew() {
        assertEquals(0.1, parser.getWindowSize());
        assertEquals(0.15, parser.getProbationaryPercent());
        assertEquals(0.5, parser.getThreshold());
        assertEquals("standard", parser.getProfileName());
        assertEquals("detector", parser.getDetectorName());
        assertEquals("yyyy-MM-dd HH:mm:ss", parser.getTimestampFormat());
        assertEquals(",", parser.getDelimiter());
        assertFalse(parser.getHeaderRow());
        assertFalse(parser.getNormalize());
        assertFalse(parser.getFlatScoring());
    }

    @Test
    public void testParse() {
        parser.parse("--window-size", "0.2", "--probationary-percent", "0.3", "--threshold", "0.9", "--profile",
                "reward_low_FP_rate", "--detector-name", "numenta", "--timestamp-format", "yyyy-MM-dd'T'HH:mm",
                "--delimiter", "\t", "--header-row", "true", "--normalize", "true", "--flat-scoring", "true");

        assertEquals(0.2, parser.getWindowSize());
        assertEquals(0.3, parser.getProbationaryPercent());
        assertEquals(0.9, parser.getThreshold());
        assertEquals("reward_low_FP_rate", parser.getProfileName());
        assertEquals("numenta", parser.getDetectorName());
        assertEquals("yyyy-MM-dd'T'HH:mm", parser.getTimestampFormat());
        assertEquals("\t", parser.getDelimiter());
        assertTrue(parser.getHeaderRow());
        assertTrue(parser.getNormalize());
        assertTrue(parser.getFlatScoring());
    }

    @Test
    public void testParseShortFlags() {
        parser.parse("-w", "0.05", "-p", "0.0", "-t", "0.75", "-d", ";");

        assertEquals(0.05, parser.getWindowSize());
        assertEquals(0.0, parser.getProbationaryPercent());
        assertEquals(0.75, parser.getThreshold());
        assertEquals(";", parser.getDelimiter());
    }

    @Test
    public void testDuplicateArgument() {
        ArgumentParser.StringArgument duplicate = new ArgumentParser.StringArgument(null, "--profile", "again",
                "standard");
        assertThrows(IllegalArgumentException.class, () -> parser.addArgument(duplicate));
    }

    @Test
    public void testHelpMessage() {
        ArgumentParser.DoubleArgument argument = new ArgumentParser.DoubleArgument("-x", "--example",
                "An example.", 1.5);
        assertEquals("--example, -x: An example. (default: 1.5)", argument.getHelpMessage());

        ArgumentParser.BooleanArgument flag = new ArgumentParser.BooleanArgument(null, "--flag", "A flag.", false);
        assertEquals("--flag: A flag. (default: false)", flag.getHelpMessage());
    }
}
