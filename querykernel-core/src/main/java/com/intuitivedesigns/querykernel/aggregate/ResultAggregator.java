/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.aggregate;

import com.intuitivedesigns.querykernel.error.AggregationException;
import com.intuitivedesigns.querykernel.error.ErrorKind;
import com.intuitivedesigns.querykernel.executor.ExecutionRecord;
import com.intuitivedesigns.querykernel.executor.OperationOutcome;
import com.intuitivedesigns.querykernel.executor.OperationStatus;
import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.plan.AggregateOperation;
import com.intuitivedesigns.querykernel.plan.FetchOperation;
import com.intuitivedesigns.querykernel.plan.JoinOperation;
import com.intuitivedesigns.querykernel.plan.Operation;
import com.intuitivedesigns.querykernel.plan.Plan;
import com.intuitivedesigns.querykernel.plan.Shape;
import com.intuitivedesigns.querykernel.plan.ShapeResolver;
import com.intuitivedesigns.querykernel.plan.UnionOperation;
import com.intuitivedesigns.querykernel.types.TypeCoercion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a completed {@link ExecutionRecord} into typed rows.
 *
 * <p>Pure: reads the record and the plan, mutates neither, and returns equal results for
 * equal inputs. The final output is evaluated recursively with memoization scoped to one
 * call, so shared inputs are materialized once.</p>
 */
public final class ResultAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    /**
     * @throws AggregationException on unsupported coercions, missing join keys, or when the
     *                              final output did not succeed
     */
    public AggregationResult aggregate(ExecutionRecord record, Plan plan) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(plan, "plan");
        if (!record.planId().equals(plan.id())) {
            throw new IllegalArgumentException("Record belongs to plan " + record.planId() + ", not " + plan.id());
        }

        Evaluation ev = new Evaluation(record, plan);
        List<ResultRow> rows = ev.eval(plan.finalOutput());
        Shape finalShape = ev.shapes.shape(plan.finalOutput());

        // fetch rows may omit fields the source did not return
        List<ResultRow> projected = new ArrayList<>(rows.size());
        for (ResultRow r : rows) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (FieldSpec f : finalShape.fields()) values.put(f.name(), r.get(f.name()));
            projected.add(new ResultRow(values, r.provenance()));
        }

        log.debug("Aggregated plan {} into {} rows", plan.id(), projected.size());
        return new AggregationResult(finalShape.fields(), projected, record.warnings());
    }

    private static final class Evaluation {
        final ExecutionRecord record;
        final Plan plan;
        final ShapeResolver shapes;
        final Map<String, List<ResultRow>> memo = new HashMap<>();

        Evaluation(ExecutionRecord record, Plan plan) {
            this.record = record;
            this.plan = plan;
            this.shapes = ShapeResolver.resolve(plan);
        }

        List<ResultRow> eval(String opId) {
            List<ResultRow> cached = memo.get(opId);
            if (cached != null) return cached;

            OperationOutcome outcome = record.outcome(opId);
            if (outcome.status() != OperationStatus.SUCCEEDED) {
                throw new AggregationException(opId, ErrorKind.INCOMPLETE_RECORD,
                        "Operation " + opId + " ended " + outcome.status() + "; nothing to aggregate");
            }

            Operation op = plan.require(opId);
            List<ResultRow> rows;
            try {
                if (op instanceof FetchOperation f) {
                    rows = fetch(f, outcome);
                } else if (op instanceof JoinOperation j) {
                    rows = HashJoiner.join(j, shapes.joinLayout(j.id()), eval(j.leftInput()), eval(j.rightInput()));
                } else if (op instanceof UnionOperation u) {
                    rows = union(u);
                } else if (op instanceof AggregateOperation a) {
                    rows = GroupAggregator.aggregate(a, shapes.shape(a.id()), eval(a.input()));
                } else {
                    throw new IllegalStateException("Unhandled operation type: " + op.getClass().getName());
                }
            } catch (AggregationException e) {
                throw e.at(opId);
            }
            memo.put(opId, rows);
            return rows;
        }

        private List<ResultRow> fetch(FetchOperation f, OperationOutcome outcome) {
            List<String> prov = List.of(f.id());
            List<ResultRow> out = new ArrayList<>(outcome.rows().size());
            for (Map<String, Object> raw : outcome.rows()) {
                Map<String, Object> values = new LinkedHashMap<>();
                for (FieldSpec spec : f.fields()) {
                    if (!raw.containsKey(spec.name())) continue;
                    values.put(spec.name(), TypeCoercion.coerce(raw.get(spec.name()), spec.type()));
                }
                out.add(new ResultRow(values, prov));
            }
            return out;
        }

        private List<ResultRow> union(UnionOperation u) {
            List<List<ResultRow>> inputs = new ArrayList<>(u.inputs().size());
            for (String in : u.inputs()) {
                if (u.tolerateFailedInputs() && record.status(in) != OperationStatus.SUCCEEDED) {
                    // the executor already recorded why this input is missing
                    inputs.add(null);
                    continue;
                }
                inputs.add(eval(in));
            }
            return UnionMerger.merge(shapes.unionLayout(u.id()), inputs, u.distinct());
        }
    }
}
