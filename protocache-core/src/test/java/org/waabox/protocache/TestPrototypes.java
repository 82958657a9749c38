package org.waabox.protocache;

import java.util.ArrayList;
import java.util.List;

import org.waabox.protocache.model.Prototype;
import org.waabox.protocache.model.UpstreamPrototype;

/**
 * Record fixtures shared by the tests.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TestPrototypes {

  private TestPrototypes() {
  }

  public static Prototype prototype(final int id) {
    return Prototype.builder(id)
        .prototypeNm("Prototype " + id)
        .tags(List.of("iot", "maker"))
        .build();
  }

  public static List<Prototype> prototypes(final int from, final int to) {
    final List<Prototype> result = new ArrayList<>();
    for (int id = from; id <= to; id++) {
      result.add(prototype(id));
    }
    return result;
  }

  public static UpstreamPrototype upstream(final int id) {
    return UpstreamPrototype.builder(id)
        .prototypeNm("Prototype " + id)
        .tags("iot|maker")
        .users("alice|bob")
        .createDate("2024-01-01 09:00:00.0")
        .updateDate("2024-01-02 09:00:00.0")
        .build();
  }

  public static List<UpstreamPrototype> upstreams(final int from,
      final int to) {
    final List<UpstreamPrototype> result = new ArrayList<>();
    for (int id = from; id <= to; id++) {
      result.add(upstream(id));
    }
    return result;
  }
}
