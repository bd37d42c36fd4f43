// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.codec;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StructEncodingTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  public record Point(int x, int y) {
  }

  public record Line(Point from, Point to) {
  }

  public record Person(
      String name,
      @CodecField(omitEmpty = true) String nick,
      @CodecField(omitEmpty = true) int age,
      @CodecField("e-mail") String email,
      @CodecField(skip = true) String password) {
  }

  @CodecStruct(omitEmpty = true)
  public record Sparse(boolean flag, int i, long l, double d, float f, char c, String s,
                       List<String> list, Map<String, String> map, int[] arr,
                       Optional<String> opt, Object any, Point point) {
  }

  public record Audit(String createdBy, long createdAt) {
  }

  public record Document(String title, @CodecField(inline = true) Audit audit, String createdBy) {
  }

  public record Versioned(@CodecField(inline = true) Document document, int version) {
  }

  public record Loop(String name, @CodecField(inline = true) Loop next) {
  }

  public record BadInline(@CodecField(inline = true) String notARecord) {
  }

  public record Empty() {
  }

  static List<String> encode(Object value) throws EncodeException {
    final var recorders = new ArrayList<RecordingEncoder>();
    final var handle = Handle.builder().primitiveEncoder(sink -> {
      final var recorder = new RecordingEncoder();
      recorders.add(recorder);
      return recorder;
    }).build();
    Encoder.forBytes(new ByteSlot(), handle).encode(value);
    return recorders.get(0).events;
  }

  @Test
  void recordIsAMapInComponentOrder() throws EncodeException {
    assertThat(encode(new Line(new Point(1, 2), new Point(3, 4)))).containsExactly(
        "map(2)",
        "sym(from)", "map(2)", "sym(x)", "int(1)", "sym(y)", "int(2)",
        "sym(to)", "map(2)", "sym(x)", "int(3)", "sym(y)", "int(4)");
  }

  @Test
  void emptyRecordIsAnEmptyMap() throws EncodeException {
    assertThat(encode(new Empty())).containsExactly("map(0)");
  }

  @Test
  @DisplayName("omitEmpty drops empty fields, other fields are always written")
  void omitEmptyOnlyAffectsFlaggedFields() throws EncodeException {
    assertThat(encode(new Person("", null, 0, null, "secret"))).containsExactly(
        "map(2)", "sym(name)", "str()", "sym(e-mail)", "nil");
    assertThat(encode(new Person("Ann", "annie", 30, "a@b.c", "secret"))).containsExactly(
        "map(4)", "sym(name)", "str(Ann)", "sym(nick)", "str(annie)", "sym(age)", "int(30)",
        "sym(e-mail)", "str(a@b.c)");
  }

  @Test
  void structWideOmitEmptyDropsEveryEmptyValue() throws EncodeException {
    final var allEmpty = new Sparse(false, 0, 0L, 0.0, -0.0f, '\0', "", List.of(), Map.of(), new int[0],
        Optional.empty(), null, null);
    assertThat(encode(allEmpty)).containsExactly("map(0)");
  }

  @Test
  void nonEmptyValuesSurviveStructWideOmitEmpty() throws EncodeException {
    final var full = new Sparse(true, 1, -1L, Double.NaN, 0.5f, 'x', "s", List.of("a"), Map.of("k", "v"),
        new int[]{0}, Optional.of(""), 7L, new Point(0, 0));
    final var events = encode(full);
    assertThat(events.get(0)).isEqualTo("map(13)");
    assertThat(events).contains("sym(opt)", "str()", "sym(any)", "int(7)", "sym(point)");
  }

  @Test
  void inlinedRecordIsFlattenedAndShadowed() throws EncodeException {
    final var document = new Document("Report", new Audit("bob", 42L), "alice");
    assertThat(encode(document)).containsExactly(
        "map(3)",
        "sym(title)", "str(Report)",
        "sym(createdAt)", "int(42)",
        "sym(createdBy)", "str(alice)");
  }

  @Test
  void nullInlinedRecordYieldsNilFields() throws EncodeException {
    assertThat(encode(new Document("Report", null, "alice"))).containsExactly(
        "map(3)",
        "sym(title)", "str(Report)",
        "sym(createdAt)", "nil",
        "sym(createdBy)", "str(alice)");
  }

  @Test
  void inlineNestsThroughSeveralLevels() throws EncodeException {
    final var versioned = new Versioned(new Document("T", new Audit("x", 1L), "y"), 3);
    assertThat(encode(versioned)).containsExactly(
        "map(4)",
        "sym(title)", "str(T)",
        "sym(createdAt)", "int(1)",
        "sym(createdBy)", "str(y)",
        "sym(version)", "int(3)");
  }

  @Test
  void fieldDescriptorsCarryIndexOrPath() {
    final var fields = StructInfo.of(Document.class).fields();
    assertThat(fields).extracting(FieldInfo::name).containsExactly("title", "createdAt", "createdBy");
    assertThat(fields.get(0).index()).isZero();
    assertThat(fields.get(0).direct()).isTrue();
    assertThat(fields.get(1).index()).isEqualTo(-1);
    assertThat(fields.get(1).path()).hasSize(2);
    assertThat(fields.get(2).index()).isEqualTo(2);
  }

  @Test
  void fieldDescriptorsAreCachedPerClass() {
    assertThat(StructInfo.of(Person.class)).isSameAs(StructInfo.of(Person.class));
    assertThat(StructInfo.of(Person.class).fields()).extracting(FieldInfo::name)
        .containsExactly("name", "nick", "age", "e-mail");
  }

  @Test
  void inlineCycleIsRejected() {
    assertThatThrownBy(() -> StructInfo.of(Loop.class))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("cycle");
  }

  @Test
  void onlyRecordsCanBeInlined() {
    assertThatThrownBy(() -> StructInfo.of(BadInline.class))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("notARecord");
  }

  @Test
  void nonRecordsHaveNoStructInfo() {
    assertThatThrownBy(() -> StructInfo.of(String.class))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void directAndInlinedFieldsResolveTheirValues() throws Throwable {
    final var fields = StructInfo.of(Document.class).fields();
    final var document = new Document("Report", new Audit("bob", 42L), "alice");
    assertThat(fields.get(0).valueOf(document)).isEqualTo("Report");
    assertThat(fields.get(1).valueOf(document)).isEqualTo(42L);
    assertThat(fields.get(2).valueOf(document)).isEqualTo("alice");
    assertThat(fields.get(1).valueOf(new Document("Report", null, "alice"))).isNull();
  }
}
