package com.ospicorp.analyticsapi.analytics.service;

import com.ospicorp.analyticsapi.analytics.model.ColumnProfile;
import com.ospicorp.analyticsapi.analytics.model.DatasetProfile;
import com.ospicorp.analyticsapi.dataset.model.Column;
import com.ospicorp.analyticsapi.dataset.model.NumericColumn;
import com.ospicorp.analyticsapi.dataset.model.Table;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Service;

@Service
public class ProfileService {

  public DatasetProfile profile(Table table) {
    if (table.rowCount() == 0) {
      return new DatasetProfile(0, 0, 0, 0, List.of());
    }
    List<ColumnProfile> columns = new ArrayList<>(table.columnCount());
    int missing = 0;
    for (Column column : table.columns()) {
      ColumnProfile profile = profileColumn(column);
      missing += profile.missingCount();
      columns.add(profile);
    }
    return new DatasetProfile(table.rowCount(), table.columnCount(), missing,
        countDuplicateRows(table), columns);
  }

  private ColumnProfile profileColumn(Column column) {
    Set<Object> distinct = new HashSet<>();
    for (int row = 0; row < column.size(); row++) {
      if (!column.isMissing(row)) {
        distinct.add(column.value(row));
      }
    }
    int missing = column.missingCount();
    if (column instanceof NumericColumn numeric && missing < numeric.size()) {
      Statistics.Summary s = Statistics.summarize(numeric.presentValues());
      return new ColumnProfile(column.name(), column.type().code(), missing, distinct.size(),
          s.min(), s.max(), s.mean(), s.median(), s.std());
    }
    return new ColumnProfile(column.name(), column.type().code(), missing, distinct.size(),
        null, null, null, null, null);
  }

  private int countDuplicateRows(Table table) {
    Set<Map<String, Object>> seen = new HashSet<>();
    int duplicates = 0;
    for (Map<String, Object> row : table.toRecords()) {
      if (!seen.add(row)) {
        duplicates++;
      }
    }
    return duplicates;
  }
}
