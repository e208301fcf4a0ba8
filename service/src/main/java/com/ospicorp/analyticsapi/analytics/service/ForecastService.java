package com.ospicorp.analyticsapi.analytics.service;

import com.ospicorp.analyticsapi.analytics.model.DataPoint;
import com.ospicorp.analyticsapi.analytics.model.ForecastMethod;
import com.ospicorp.analyticsapi.analytics.model.ForecastResult;
import com.ospicorp.analyticsapi.analytics.model.Frequency;
import com.ospicorp.analyticsapi.dataset.model.Column;
import com.ospicorp.analyticsapi.dataset.model.DatetimeColumn;
import com.ospicorp.analyticsapi.dataset.model.NumericColumn;
import com.ospicorp.analyticsapi.dataset.model.Table;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class ForecastService {
  private static final Logger log = LoggerFactory.getLogger(ForecastService.class);

  public static final int STEPS = 12;

  private final ModelingCapabilities capabilities;
  private final ForecastModel primary;
  private final ForecastModel fallback = new MovingAverageForecaster();

  @Autowired
  public ForecastService(ModelingCapabilities capabilities) {
    this(capabilities, new ArimaForecaster());
  }

  ForecastService(ModelingCapabilities capabilities, ForecastModel primary) {
    this.capabilities = capabilities;
    this.primary = primary;
  }

  public ForecastResult forecast(Table table, String targetColumn, String timeColumn) {
    if (table.isEmpty() || !StringUtils.hasText(targetColumn)) {
      return ForecastResult.rejected(ForecastResult.MISSING_TARGET);
    }
    Optional<Column> target = table.column(targetColumn);
    if (target.isEmpty()) {
      return ForecastResult.rejected(ForecastResult.MISSING_TARGET);
    }
    if (!(target.get() instanceof NumericColumn values)) {
      return ForecastResult.rejected("Target column '" + targetColumn + "' is not numeric.");
    }

    double[] series = buildSeries(table, values, timeColumn);
    if (series.length == 0) {
      return ForecastResult.rejected(ForecastResult.MISSING_TARGET);
    }
    return project(series);
  }

  ForecastResult project(double[] series) {
    if (capabilities.arimaEnabled() && series.length >= ArimaForecaster.MIN_OBSERVATIONS) {
      try {
        double[] values = primary.forecast(series, STEPS);
        if (values.length != STEPS) {
          throw new ModelingException("Expected " + STEPS + " steps, got " + values.length);
        }
        return ForecastResult.of(toList(values), ForecastMethod.ARIMA);
      } catch (RuntimeException ex) {
        log.debug("ARIMA(1,1,1) failed on {} points, using moving average: {}", series.length,
            ex.getMessage());
      }
    }
    return ForecastResult.of(toList(fallback.forecast(series, STEPS)),
        ForecastMethod.MOVING_AVERAGE);
  }

  private double[] buildSeries(Table table, NumericColumn values, String timeColumn) {
    Column axis = resolveTimeAxis(table, timeColumn);
    if (axis instanceof DatetimeColumn time) {
      return datetimeSeries(time, values);
    }
    if (axis instanceof NumericColumn numericAxis) {
      return numericAxisSeries(numericAxis, values);
    }
    // positional axis: rows are already in identifier order
    return values.presentValues();
  }

  private Column resolveTimeAxis(Table table, String timeColumn) {
    if (StringUtils.hasText(timeColumn)) {
      return table.column(timeColumn)
          .filter(c -> c instanceof DatetimeColumn || c instanceof NumericColumn)
          .orElse(null);
    }
    List<DatetimeColumn> datetimes = table.datetimeColumns();
    return datetimes.isEmpty() ? null : datetimes.get(0);
  }

  private double[] datetimeSeries(DatetimeColumn time, NumericColumn values) {
    List<DataPoint> points = new ArrayList<>();
    for (int row = 0; row < values.size(); row++) {
      if (!time.isMissing(row) && !values.isMissing(row)) {
        points.add(new DataPoint(time.value(row), values.value(row)));
      }
    }
    points.sort(Comparator.comparing(DataPoint::time));
    Optional<Frequency> frequency = Resampler.inferFrequency(
        points.stream().map(DataPoint::time).toList());
    if (frequency.isPresent()) {
      points = Resampler.align(points, frequency.get());
    } else {
      log.debug("No regular frequency in {} timestamps; keeping irregular order", points.size());
    }
    return points.stream().mapToDouble(DataPoint::value).toArray();
  }

  private double[] numericAxisSeries(NumericColumn axis, NumericColumn values) {
    List<double[]> pairs = new ArrayList<>();
    for (int row = 0; row < values.size(); row++) {
      if (!axis.isMissing(row) && !values.isMissing(row)) {
        pairs.add(new double[] {axis.value(row), values.value(row)});
      }
    }
    pairs.sort(Comparator.comparingDouble(pair -> pair[0]));
    return pairs.stream().mapToDouble(pair -> pair[1]).toArray();
  }

  private static List<Double> toList(double[] values) {
    return Arrays.stream(values).boxed().toList();
  }
}
