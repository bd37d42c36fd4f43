// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.codec;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.lang.reflect.Array;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static io.github.simbo1905.codec.EncodeException.Reason.EXTENSION_FAILURE;
import static io.github.simbo1905.codec.EncodeException.Reason.UNSUPPORTED_SHAPE;

/// Walks a value's runtime shape and drives a [PrimitiveEncoder].
///
/// Order of precedence:
/// 1. scalars (and optionals of scalars) given to [#encode(Object)] are written directly
/// 2. the format's [PrimitiveEncoder#encodeBuiltin] hook
/// 3. a registered extension for the exact runtime class
/// 4. the value's [Kind]
///
/// Not thread-safe; one instance serves one sink.
final class ValueEncoder {
  private final ByteSink sink;
  private final PrimitiveEncoder format;
  private final ExtensionRegistry extensions;
  private final boolean writeExt;
  private final int maxDepth;
  private int depth;

  ValueEncoder(@NotNull ByteSink sink, @NotNull Handle handle) {
    this.sink = Objects.requireNonNull(sink);
    this.format = handle.newPrimitiveEncoder(sink);
    this.extensions = handle.extensions();
    this.writeExt = handle.extensionMode() == ExtensionMode.TAGGED;
    this.maxDepth = handle.maxDepth();
  }

  PrimitiveEncoder format() {
    return format;
  }

  /// Top-level entry with the scalar fast path
  void encode(Object value) throws IOException, EncodeException {
    depth = 0;
    if (value == null) {
      format.encodeNil();
    } else if (!encodeScalar(value) && !encodeOptionalScalar(value)) {
      encodeValue(value);
    }
  }

  /// Fast path for an optional that is empty or holds a scalar
  private boolean encodeOptionalScalar(Object value) throws IOException {
    if (!(value instanceof Optional<?> optional)) {
      return false;
    }
    if (optional.isEmpty()) {
      format.encodeNil();
      return true;
    }
    return encodeScalar(optional.get());
  }

  /// Write a boxed scalar without consulting the format hook or the registry.
  /// @return false if the value is not one of the built-in scalar classes
  private boolean encodeScalar(Object value) throws IOException {
    if (value instanceof String s) {
      format.encodeString(CharEncoding.UTF8, s);
    } else if (value instanceof Integer i) {
      format.encodeInt(i);
    } else if (value instanceof Long l) {
      format.encodeInt(l);
    } else if (value instanceof Boolean b) {
      format.encodeBool(b);
    } else if (value instanceof Double d) {
      format.encodeFloat64(d);
    } else if (value instanceof Float f) {
      format.encodeFloat32(f);
    } else if (value instanceof Short s) {
      format.encodeInt(s);
    } else if (value instanceof Byte b) {
      format.encodeInt(b);
    } else if (value instanceof Character c) {
      format.encodeUint(c);
    } else {
      return false;
    }
    return true;
  }

  /// The generic path: format hook, then extension, then kind
  void encodeValue(Object value) throws IOException, EncodeException {
    if (value == null) {
      format.encodeNil();
      return;
    }
    final Class<?> type = value.getClass();
    if (format.encodeBuiltin(type, value)) {
      return;
    }
    final ExtensionEntry extension = extensions.find(type);
    if (extension != null) {
      encodeExtension(extension, value);
      return;
    }
    final Kind kind = Kind.of(value);
    switch (kind) {
      case BOOL -> format.encodeBool((Boolean) value);
      case STRING -> format.encodeString(CharEncoding.UTF8, (String) value);
      case FLOAT64 -> format.encodeFloat64((Double) value);
      case FLOAT32 -> format.encodeFloat32((Float) value);
      case INT -> format.encodeInt(((Number) value).longValue());
      case UINT -> format.encodeUint((Character) value);
      case BYTES -> format.encodeStringBytes(CharEncoding.RAW, (byte[]) value);
      case ARRAY -> encodeArray(value);
      case SLICE -> encodeCollection((Collection<?>) value);
      case MAP -> encodeMap((Map<?, ?>) value);
      case STRUCT -> encodeStruct(type, value);
      case POINTER -> {
        if (Kind.isPresent(value)) {
          enter(type);
          encodeValue(Kind.content(value));
          depth--;
        } else {
          format.encodeNil();
        }
      }
      case INVALID -> format.encodeNil();
      case UNSUPPORTED -> throw new EncodeException(UNSUPPORTED_SHAPE,
          "Unsupported kind: " + kind + ", for: " + type.getName() + "@"
              + Integer.toHexString(System.identityHashCode(value)));
    }
  }

  private void encodeExtension(ExtensionEntry extension, Object value) throws IOException, EncodeException {
    final byte[] payload;
    try {
      payload = extension.apply(value);
    } catch (EncodeException e) {
      throw e;
    } catch (Throwable t) {
      throw new EncodeException(EXTENSION_FAILURE, "Extension tag " + extension.tag() + " for "
          + extension.type().getName() + " failed: " + t, t);
    }
    if (payload == null) {
      format.encodeNil();
    } else if (writeExt) {
      format.encodeExtPreamble(extension.tag(), payload.length);
      sink.writeBytes(payload);
    } else {
      format.encodeStringBytes(CharEncoding.RAW, payload);
    }
  }

  private void encodeArray(Object array) throws IOException, EncodeException {
    final int length = Array.getLength(array);
    format.encodeArrayPreamble(length);
    if (length == 0) {
      return;
    }
    enter(array.getClass());
    if (array instanceof Object[] elements) {
      for (Object element : elements) {
        encodeValue(element);
      }
    } else {
      for (int i = 0; i < length; i++) {
        encodeValue(Array.get(array, i));
      }
    }
    depth--;
  }

  private void encodeCollection(Collection<?> collection) throws IOException, EncodeException {
    final int length = collection.size();
    format.encodeArrayPreamble(length);
    if (length == 0) {
      return;
    }
    enter(collection.getClass());
    for (Object element : collection) {
      encodeValue(element);
    }
    depth--;
  }

  /// Entries go out in the map's own iteration order. String keys are written as symbols.
  private void encodeMap(Map<?, ?> map) throws IOException, EncodeException {
    final int length = map.size();
    format.encodeMapPreamble(length);
    if (length == 0) {
      return;
    }
    enter(map.getClass());
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      final Object key = entry.getKey();
      if (key instanceof String symbol) {
        format.encodeSymbol(symbol);
      } else {
        encodeValue(key);
      }
      encodeValue(entry.getValue());
    }
    depth--;
  }

  /// A record is written as a map of field name to value, after dropping omit-empty fields whose value is empty
  private void encodeStruct(Class<?> type, Object record) throws IOException, EncodeException {
    final List<FieldInfo> fields = StructInfo.of(type).fields();
    final int count = fields.size();
    final String[] names = new String[count];
    final Object[] values = new Object[count];
    int kept = 0;
    for (FieldInfo field : fields) {
      final Object fieldValue = fieldValue(field, record);
      if (field.omitEmpty() && Kind.isEmptyValue(fieldValue)) {
        continue;
      }
      names[kept] = field.name();
      values[kept] = fieldValue;
      kept++;
    }
    format.encodeMapPreamble(kept);
    if (kept == 0) {
      return;
    }
    enter(type);
    for (int j = 0; j < kept; j++) {
      format.encodeSymbol(names[j]);
      encodeValue(values[j]);
    }
    depth--;
  }

  private static Object fieldValue(FieldInfo field, Object record) {
    try {
      return field.valueOf(record);
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Throwable t) {
      throw new IllegalStateException("Failed to read field " + field.name() + " of " + record.getClass().getName(), t);
    }
  }

  private void enter(Class<?> container) throws EncodeException {
    if (++depth > maxDepth) {
      throw new EncodeException(UNSUPPORTED_SHAPE, "Maximum nesting depth " + maxDepth
          + " exceeded inside " + container.getName());
    }
  }
}
