package org.waabox.protocache.store;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.waabox.protocache.model.Prototype;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;

/** Jackson-based {@link SnapshotSizeEstimator}.
 *
 * <p>Measures the UTF-8 length of the JSON array the records would
 * serialize to. Each record is written on its own to a counting stream, so
 * the whole array is never materialized in memory. The array overhead is
 * added separately: two brackets plus one comma between each pair of
 * records.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class JsonSnapshotSizeEstimator implements SnapshotSizeEstimator {

  /** The Jackson object mapper used to serialize each record. */
  private final ObjectMapper mapper;

  /** Creates a new estimator with a pre-configured {@link ObjectMapper}. */
  public JsonSnapshotSizeEstimator() {
    this(defaultMapper());
  }

  /** Creates a new estimator with the given mapper.
   *
   * @param theMapper the mapper used to serialize records, never null.
   */
  public JsonSnapshotSizeEstimator(final ObjectMapper theMapper) {
    mapper = Objects.requireNonNull(theMapper, "mapper cannot be null");
  }

  /** {@inheritDoc}
   *
   * @throws UncheckedIOException if a record cannot be serialized
   */
  @Override
  public long estimate(final List<Prototype> records) {
    Objects.requireNonNull(records, "records cannot be null");
    if (records.isEmpty()) {
      return 2;
    }
    final CountingOutputStream counter = new CountingOutputStream();
    for (Prototype record : records) {
      try {
        mapper.writeValue(counter, record);
      } catch (final IOException e) {
        throw new UncheckedIOException("Failed to serialize prototype "
            + record.getId(), e);
      }
    }
    return counter.count + 2 + (records.size() - 1);
  }

  /** Creates the mapper used when none is provided.
   *
   * @return a new mapper, never null.
   */
  static ObjectMapper defaultMapper() {
    final ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    mapper.setVisibility(PropertyAccessor.FIELD, Visibility.ANY);
    mapper.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    return mapper;
  }

  /** An output stream that discards its input and counts the bytes. */
  private static final class CountingOutputStream extends OutputStream {

    /** The number of bytes written so far. */
    private long count;

    @Override
    public void write(final int b) {
      count++;
    }

    @Override
    public void write(final byte[] b, final int off, final int len) {
      count += len;
    }
  }
}
