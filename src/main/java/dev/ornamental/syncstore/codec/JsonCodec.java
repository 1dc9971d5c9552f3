package dev.ornamental.syncstore.codec;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.ornamental.syncstore.ValueDecodingException;
import dev.ornamental.syncstore.ValueEncodingException;

/**
 * This class is a JSON {@link ValueCodec} based on Jackson data binding. The whole stored
 * representation of a value is a single JSON document in UTF-8.<br>
 * Decoding is strict: trailing content after the document, unknown object properties, empty input,
 * a {@code null} document and scalars of a different JSON type (strings for numbers, fractions
 * for integers) are all reported as {@link ValueDecodingException}.
 * @param <T> the type of the converted values
 */
public final class JsonCodec<T> implements ValueCodec<T> {

	private final JavaType type;

	private final ObjectReader reader;

	private final ObjectWriter writer;

	private JsonCodec(JsonMapper mapper, JavaType type) {
		this.type = type;
		this.reader = mapper.readerFor(type);
		this.writer = mapper.writer();
	}

	/**
	 * Creates a codec with the default configuration for a non-generic type.
	 * @param type the class of the converted values
	 * @param <T> the type of the converted values
	 * @return the codec
	 */
	public static <T> JsonCodec<T> forClass(Class<T> type) {
		return forClass(type, JsonCodecConfig.defaults());
	}

	/**
	 * Creates a codec for a non-generic type.
	 * @param type the class of the converted values
	 * @param config the JSON representation options
	 * @param <T> the type of the converted values
	 * @return the codec
	 */
	public static <T> JsonCodec<T> forClass(Class<T> type, JsonCodecConfig config) {
		JsonMapper mapper = createMapper(config);
		return new JsonCodec<>(mapper, mapper.constructType(type));
	}

	/**
	 * Creates a codec with the default configuration for a possibly generic type,
	 * e.g. {@code JsonCodec.forType(new TypeReference<Map<String, Integer>>() { })}.
	 * @param type the reference to the type of the converted values
	 * @param <T> the type of the converted values
	 * @return the codec
	 */
	public static <T> JsonCodec<T> forType(TypeReference<T> type) {
		return forType(type, JsonCodecConfig.defaults());
	}

	/**
	 * Creates a codec for a possibly generic type.
	 * @param type the reference to the type of the converted values
	 * @param config the JSON representation options
	 * @param <T> the type of the converted values
	 * @return the codec
	 */
	public static <T> JsonCodec<T> forType(TypeReference<T> type, JsonCodecConfig config) {
		JsonMapper mapper = createMapper(config);
		return new JsonCodec<>(mapper, mapper.constructType(type));
	}

	@Override
	public byte[] encode(T value) throws ValueEncodingException {
		try {
			return writer.writeValueAsBytes(value);
		} catch (JsonProcessingException e) {
			throw new ValueEncodingException("Could not encode a value of type " + type + " as JSON.", e);
		}
	}

	@Override
	public T decode(byte[] bytes) throws ValueDecodingException {
		T value;
		try {
			value = reader.readValue(bytes);
		} catch (IOException e) {
			throw new ValueDecodingException("The contents are not a valid JSON encoding of " + type + ".", e);
		}
		if (value == null) {
			throw new ValueDecodingException("The contents encode a null value instead of " + type + ".");
		}
		return value;
	}

	private static JsonMapper createMapper(JsonCodecConfig config) {
		JsonFactoryBuilder factoryBuilder = new JsonFactoryBuilder();
		if (config.isUnboundedDepth()) {
			factoryBuilder
				.streamReadConstraints(StreamReadConstraints.builder().maxNestingDepth(Integer.MAX_VALUE).build())
				.streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(Integer.MAX_VALUE).build());
		}
		JsonFactory factory = factoryBuilder.build();

		boolean bigNumbers = config.isArbitraryPrecision();
		boolean fastDoubles = !config.isFloatRoundtrip();
		return JsonMapper.builder(factory)
			.configure(SerializationFeature.INDENT_OUTPUT, config.isPretty())
			.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, !config.isPreserveOrder())
			.configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, bigNumbers)
			.configure(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS, bigNumbers)
			.configure(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN, bigNumbers)
			.configure(StreamReadFeature.USE_FAST_DOUBLE_PARSER, fastDoubles)
			.configure(StreamWriteFeature.USE_FAST_DOUBLE_WRITER, fastDoubles)
			.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true)
			.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
			.configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false)
			.configure(MapperFeature.ALLOW_COERCION_OF_SCALARS, false)
			.build();
	}
}
