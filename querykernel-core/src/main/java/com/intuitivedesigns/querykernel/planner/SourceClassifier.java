/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.planner;

import com.intuitivedesigns.querykernel.model.SourceDescriptor;

import java.util.List;

/**
 * Picks the sources worth planning against for a question.
 */
public interface SourceClassifier {

    /**
     * @return enabled candidates, most relevant first; may be empty
     */
    List<SourceDescriptor> candidates(String question);
}
