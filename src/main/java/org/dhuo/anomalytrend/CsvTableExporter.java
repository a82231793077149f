package org.dhuo.anomalytrend;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

/**
 * Writes {@link ResultTable}s as CSV with a header row.
 */
public class CsvTableExporter implements ResultExporter<ResultTable> {
  private static final Logger LOG = LoggerFactory.getLogger(CsvTableExporter.class);

  @Override
  public void save(ResultTable table, String destination, ExportFormat format, double scale)
      throws IOException {
    if (format != ExportFormat.CSV) {
      throw new IllegalArgumentException("Tables export only as CSV, not " + format);
    }
    Path path = new Path(destination);
    FileSystem fs = path.getFileSystem(new Configuration());
    PrintStream fout = new PrintStream(fs.create(path, true), false, "UTF-8");
    try {
      fout.print(line(table.header) + "\n");
      for (List<String> row : table.rows) {
        fout.print(line(row) + "\n");
      }
    } finally {
      fout.close();
    }
    LOG.info("Saved {} rows to {}", table.rows.size(), destination);
  }

  static String line(List<String> cells) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < cells.size(); ++i) {
      if (i > 0) sb.append(',');
      sb.append(quote(cells.get(i)));
    }
    return sb.toString();
  }

  static String quote(String cell) {
    if (cell.indexOf(',') < 0 && cell.indexOf('"') < 0 && cell.indexOf('\n') < 0) {
      return cell;
    }
    return '"' + cell.replace("\"", "\"\"") + '"';
  }
}
