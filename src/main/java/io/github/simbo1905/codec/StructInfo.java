// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.codec;

import org.jetbrains.annotations.NotNull;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static io.github.simbo1905.codec.Encoder.LOGGER;

/// The ordered encodable fields of a record class, computed once per class and cached.
///
/// Field names come from the component name or [CodecField#value()]. Components of inlined records are
/// flattened in place. When names clash the shallowest field is kept and the deeper ones are dropped.
record StructInfo(Class<?> type, List<FieldInfo> fields) {

  private static final MethodType ACCESSOR_TYPE = MethodType.methodType(Object.class, Object.class);

  private static final ClassValue<StructInfo> CACHE = new ClassValue<>() {
    @Override
    protected StructInfo computeValue(Class<?> type) {
      return analyze(type);
    }
  };

  StructInfo {
    fields = List.copyOf(fields);
  }

  /// @throws IllegalArgumentException if `type` is not a record, or its inlined records form a cycle
  static StructInfo of(Class<?> type) {
    if (!type.isRecord()) {
      throw new IllegalArgumentException("Not a record: " + type.getName());
    }
    return CACHE.get(type);
  }

  private static @NotNull StructInfo analyze(@NotNull Class<?> type) {
    final var collected = new ArrayList<Candidate>();
    collect(type, new MethodHandle[0], 0, new LinkedHashSet<>(), collected);

    // shallower fields win a name clash; the stable sort keeps component order within a depth
    final var byDepth = new ArrayList<>(collected);
    byDepth.sort((a, b) -> Integer.compare(a.depth(), b.depth()));
    final Set<String> claimed = new HashSet<>();
    final Set<Candidate> winners = new HashSet<>();
    for (Candidate candidate : byDepth) {
      if (claimed.add(candidate.info().name())) {
        winners.add(candidate);
      } else {
        LOGGER.fine(() -> "Dropping inlined field " + candidate.info().name() + " of " + type.getName()
            + " which is shadowed by a shallower field");
      }
    }
    final var fields = collected.stream()
        .filter(winners::contains)
        .map(Candidate::info)
        .toList();

    final var info = new StructInfo(type, fields);
    LOGGER.fine(() -> "Created StructInfo for " + type.getName() + ": "
        + fields.stream().map(FieldInfo::name).collect(Collectors.joining(",")));
    return info;
  }

  private static void collect(Class<?> type, MethodHandle[] prefix, int depth,
                              Set<Class<?>> inlining, List<Candidate> out) {
    if (!inlining.add(type)) {
      throw new IllegalArgumentException("Inlined records form a cycle: "
          + inlining.stream().map(Class::getName).collect(Collectors.joining(" -> ")) + " -> " + type.getName());
    }
    final var struct = type.getAnnotation(CodecStruct.class);
    final boolean omitAll = struct != null && struct.omitEmpty();
    final RecordComponent[] components = type.getRecordComponents();
    for (int i = 0; i < components.length; i++) {
      final RecordComponent component = components[i];
      final CodecField options = component.getAnnotation(CodecField.class);
      if (options != null && options.skip()) {
        continue;
      }
      final MethodHandle[] path = Arrays.copyOf(prefix, prefix.length + 1);
      path[prefix.length] = accessor(component);
      if (options != null && options.inline()) {
        if (!component.getType().isRecord()) {
          throw new IllegalArgumentException("Only record components can be inlined: "
              + type.getName() + "." + component.getName() + " is " + component.getType().getName());
        }
        collect(component.getType(), path, depth + 1, inlining, out);
        continue;
      }
      final String name = options != null && !options.value().isEmpty() ? options.value() : component.getName();
      final boolean omitEmpty = omitAll || (options != null && options.omitEmpty());
      final int index = depth == 0 ? i : -1;
      out.add(new Candidate(new FieldInfo(name, omitEmpty, index, path), depth));
    }
    inlining.remove(type);
  }

  private static @NotNull MethodHandle accessor(RecordComponent component) {
    final Method method = component.getAccessor();
    try {
      return MethodHandles.lookup().unreflect(method).asType(ACCESSOR_TYPE);
    } catch (IllegalAccessException e) {
      try {
        method.setAccessible(true);
        return MethodHandles.lookup().unreflect(method).asType(ACCESSOR_TYPE);
      } catch (RuntimeException | IllegalAccessException retry) {
        retry.addSuppressed(e);
        throw new IllegalArgumentException("Failed to create accessor for " + component.getName(), retry);
      }
    }
  }

  /// A field plus its inline depth, identity-compared while resolving name clashes
  private static final class Candidate {
    private final FieldInfo info;
    private final int depth;

    Candidate(FieldInfo info, int depth) {
      this.info = info;
      this.depth = depth;
    }

    FieldInfo info() {
      return info;
    }

    int depth() {
      return depth;
    }
  }
}
