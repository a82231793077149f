package org.dhuo.anomalytrend;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Frames stored as one multi-band TIFF per acquisition, named {@code yyyy-MM-dd[anything].tif},
 * in a single directory on any Hadoop-supported file system.
 */
public class DirectoryFrameSource extends AbstractFrameSource {
  private static final Logger LOG = LoggerFactory.getLogger(DirectoryFrameSource.class);
  private static final Pattern FRAME_NAME =
      Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}).*\\.tiff?$", Pattern.CASE_INSENSITIVE);

  private final String directory;
  private final double noDataSentinel;
  private transient Set<String> schemaBands;
  private transient GridGeometry grid;

  public DirectoryFrameSource(String datasetId, String directory, double noDataSentinel) {
    super(datasetId);
    this.directory = directory;
    this.noDataSentinel = noDataSentinel;
  }

  /** Grid of the earliest frame; all frames are expected to share it. */
  @Override
  public synchronized GridGeometry getGrid() throws IOException {
    if (grid == null) {
      Map<String, Path> frames = listFrames();
      if (frames.isEmpty()) {
        throw new IOException("No frame files under " + directory);
      }
      Path first = frames.values().iterator().next();
      grid = TiffRasterReader.read(first.toString(), noDataSentinel).getGrid();
    }
    return grid;
  }

  @Override
  public synchronized Set<String> getSchemaBands() throws IOException {
    if (schemaBands == null) {
      Set<String> bands = new LinkedHashSet<String>();
      for (Path path : listFrames().values()) {
        List<String> fromHeader = TiffRasterReader.headerBands(path.toString());
        if (fromHeader != null) {
          bands.addAll(fromHeader);
        } else {
          bands.addAll(TiffRasterReader.read(path.toString(), noDataSentinel).getBandNames());
        }
      }
      schemaBands = Collections.unmodifiableSet(bands);
    }
    return schemaBands;
  }

  @Override
  protected List<RasterFrame> framesIn(DateRange range) throws IOException {
    List<RasterFrame> ret = new ArrayList<RasterFrame>();
    for (Map.Entry<String, Path> entry : listFrames().entrySet()) {
      LocalDate date = LocalDate.parse(entry.getKey().substring(0, 10));
      if (!range.contains(date)) continue;
      Path path = entry.getValue();
      Map<String, String> metadata = new TreeMap<String, String>();
      metadata.put("source", path.toString());
      ret.add(new RasterFrame(
          date, TiffRasterReader.read(path.toString(), noDataSentinel), metadata));
    }
    LOG.debug("{} frames in {} under {}", ret.size(), range, directory);
    return ret;
  }

  /** Frame files keyed by file name. */
  private Map<String, Path> listFrames() throws IOException {
    Path dir = new Path(directory);
    FileSystem fs = dir.getFileSystem(new Configuration());
    Map<String, Path> ret = new TreeMap<String, Path>();
    for (FileStatus stat : fs.listStatus(dir)) {
      if (stat.isDirectory()) continue;
      String name = stat.getPath().getName();
      Matcher matcher = FRAME_NAME.matcher(name);
      if (!matcher.matches()) continue;
      try {
        LocalDate.parse(matcher.group(1));
      } catch (DateTimeParseException e) {
        LOG.warn("Skipping {}: bad date {}", stat.getPath(), matcher.group(1));
        continue;
      }
      ret.put(name, stat.getPath());
    }
    return ret;
  }
}
