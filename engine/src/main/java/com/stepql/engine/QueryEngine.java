/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.stepql.engine;

import com.stepql.ContextConfiguration;
import com.stepql.GlobalConfiguration;
import com.stepql.engine.QueryResult.InstantVector;
import com.stepql.engine.QueryResult.MatrixResult;
import com.stepql.engine.QueryResult.MatrixSeries;
import com.stepql.engine.QueryResult.Point;
import com.stepql.engine.QueryResult.ScalarResult;
import com.stepql.engine.QueryResult.VectorSample;
import com.stepql.exception.ErrorCode;
import com.stepql.exception.QueryException;
import com.stepql.execution.ExecutionPlanBuilder;
import com.stepql.execution.QueryContext;
import com.stepql.execution.QueryOptions;
import com.stepql.execution.VectorOperator;
import com.stepql.execution.model.Labels;
import com.stepql.execution.model.StepVector;
import com.stepql.log.LogManager;
import com.stepql.query.promql.PromQLParser;
import com.stepql.query.promql.ast.PromQLExpr;
import com.stepql.query.promql.ast.ValueType;
import com.stepql.storage.SeriesStorage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;

/**
 * Entry point: parses a query, builds the operator tree and pulls it until exhaustion, converting the step vectors into a
 * {@link QueryResult}. The query context is always closed at the end of the evaluation, so background producers stop
 * even when the evaluation fails.
 */
public class QueryEngine {
  private final SeriesStorage        storage;
  private final ContextConfiguration configuration;

  public QueryEngine(final SeriesStorage storage) {
    this(storage, new ContextConfiguration());
  }

  public QueryEngine(final SeriesStorage storage, final ContextConfiguration configuration) {
    this.storage = storage;
    this.configuration = configuration != null ? configuration : new ContextConfiguration();
  }

  public MatrixResult executeRange(final String query, final long startMs, final long endMs, final long stepMs) {
    return executeRange(PromQLParser.parse(query), startMs, endMs, stepMs);
  }

  public MatrixResult executeRange(final PromQLExpr expr, final long startMs, final long endMs, final long stepMs) {
    return executeRange(expr, startMs, endMs, stepMs, newContext());
  }

  public MatrixResult executeRange(final PromQLExpr expr, final long startMs, final long endMs, final long stepMs,
      final QueryContext context) {
    try (context) {
      validateRange(startMs, endMs, stepMs);
      final QueryOptions options = QueryOptions.fromConfiguration(configuration, startMs, endMs, stepMs);
      final VectorOperator root = ExecutionPlanBuilder.build(expr, storage, options);

      final List<Labels> series = root.series(context);
      final List<List<Point>> points = new ArrayList<>(series.size());
      for (int i = 0; i < series.size(); i++)
        points.add(null);

      int steps = 0;
      List<StepVector> batch;
      while ((batch = root.next(context)) != null) {
        for (final StepVector v : batch) {
          for (int i = 0; i < v.sampleCount(); i++)
            pointsOf(points, v.getSampleId(i)).add(new Point(v.getT(), v.getSample(i), null));
          for (int i = 0; i < v.histogramCount(); i++)
            pointsOf(points, v.getHistogramId(i)).add(new Point(v.getT(), Double.NaN, v.getHistogram(i)));
        }
        steps += batch.size();
        root.getPool().putVectors(batch);
      }

      final List<MatrixSeries> result = new ArrayList<>();
      for (int i = 0; i < points.size(); i++) {
        final List<Point> p = points.get(i);
        if (p != null) {
          p.sort((a, b) -> Long.compare(a.timestampMs(), b.timestampMs()));
          result.add(new MatrixSeries(series.get(i), Collections.unmodifiableList(p)));
        }
      }

      LogManager.instance().log(this, Level.FINE, "Range query %s completed: %d steps, %d series", expr, steps, result.size());
      return new MatrixResult(Collections.unmodifiableList(result));
    }
  }

  public QueryResult executeInstant(final String query, final long timeMs) {
    return executeInstant(PromQLParser.parse(query), timeMs);
  }

  public QueryResult executeInstant(final PromQLExpr expr, final long timeMs) {
    return executeInstant(expr, timeMs, newContext());
  }

  /**
   * @return a {@link ScalarResult} for scalar expressions, an {@link InstantVector} otherwise
   */
  public QueryResult executeInstant(final PromQLExpr expr, final long timeMs, final QueryContext context) {
    try (context) {
      final QueryOptions options = QueryOptions.fromConfiguration(configuration, timeMs, timeMs, 1);
      final VectorOperator root = ExecutionPlanBuilder.build(expr, storage, options);

      final List<Labels> series = root.series(context);
      final List<VectorSample> samples = new ArrayList<>();
      List<StepVector> batch;
      while ((batch = root.next(context)) != null) {
        for (final StepVector v : batch) {
          for (int i = 0; i < v.sampleCount(); i++)
            samples.add(new VectorSample(series.get(v.getSampleId(i)), v.getSample(i), null, v.getT()));
          for (int i = 0; i < v.histogramCount(); i++)
            samples.add(new VectorSample(series.get(v.getHistogramId(i)), Double.NaN, v.getHistogram(i), v.getT()));
        }
        root.getPool().putVectors(batch);
      }

      LogManager.instance().log(this, Level.FINE, "Instant query %s completed: %d samples", expr, samples.size());

      if (expr.type() == ValueType.SCALAR)
        return new ScalarResult(samples.isEmpty() ? Double.NaN : samples.get(0).value(), timeMs);
      return new InstantVector(Collections.unmodifiableList(samples));
    }
  }

  /**
   * Builds the operator tree for a range evaluation without pulling it.
   */
  public String explain(final String query, final long startMs, final long endMs, final long stepMs) {
    return explain(PromQLParser.parse(query), startMs, endMs, stepMs);
  }

  public String explain(final PromQLExpr expr, final long startMs, final long endMs, final long stepMs) {
    validateRange(startMs, endMs, stepMs);
    return ExecutionPlanBuilder.build(expr, storage, QueryOptions.fromConfiguration(configuration, startMs, endMs, stepMs))
        .explain();
  }

  public ContextConfiguration getConfiguration() {
    return configuration;
  }

  private QueryContext newContext() {
    return new QueryContext(configuration.getValueAsLong(GlobalConfiguration.QUERY_TIMEOUT));
  }

  private void validateRange(final long startMs, final long endMs, final long stepMs) {
    if (endMs < startMs)
      throw new QueryException(ErrorCode.INVALID_ARGUMENT, "End (" + endMs + ") must be >= start (" + startMs + ")");
    if (stepMs <= 0)
      throw new QueryException(ErrorCode.INVALID_ARGUMENT, "Step must be positive, got: " + stepMs);

    final long maxSteps = configuration.getValueAsLong(GlobalConfiguration.QUERY_MAX_STEPS);
    final long steps = (endMs - startMs) / stepMs + 1;
    if (steps > maxSteps)
      throw new QueryException(ErrorCode.INVALID_ARGUMENT,
          "Range query would produce " + steps + " steps, exceeding maximum of " + maxSteps
              + ". Increase the step or reduce the time range");
  }

  private static List<Point> pointsOf(final List<List<Point>> points, final int id) {
    List<Point> p = points.get(id);
    if (p == null) {
      p = new ArrayList<>();
      points.set(id, p);
    }
    return p;
  }
}
