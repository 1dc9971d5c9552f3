package dev.ornamental.syncstore.codec;

/**
 * Configuration class for {@link JsonCodec} instances. Every option is independent of the others
 * and affects only the JSON representation, never the values which survive a round trip.
 */
public final class JsonCodecConfig {

	/**
	 * Whether the output is indented and spread over multiple lines
	 */
	private boolean pretty = false;

	/**
	 * Whether map entries are written in their iteration order rather than sorted by key
	 */
	private boolean preserveOrder = true;

	/**
	 * Whether untyped numbers are read as {@code BigDecimal} and {@code BigInteger}
	 */
	private boolean arbitraryPrecision = false;

	/**
	 * Whether the exact JDK routines are used to read and write floating-point numbers
	 */
	private boolean floatRoundtrip = true;

	/**
	 * Whether the nesting depth of documents is unlimited
	 */
	private boolean unboundedDepth = false;

	/**
	 * Creates a configuration holding the default values: compact output, insertion order of
	 * map entries, native number types, exact floating-point conversion and the default
	 * nesting depth limit.
	 * @return new configuration with default values
	 */
	public static JsonCodecConfig defaults() {
		return new JsonCodecConfig();
	}

	public boolean isPretty() {
		return pretty;
	}

	public boolean isPreserveOrder() {
		return preserveOrder;
	}

	public boolean isArbitraryPrecision() {
		return arbitraryPrecision;
	}

	public boolean isFloatRoundtrip() {
		return floatRoundtrip;
	}

	public boolean isUnboundedDepth() {
		return unboundedDepth;
	}

	/**
	 * Selects between the indented multi-line output and the compact single-line one.
	 * @param pretty true for the indented output
	 * @return this configuration
	 */
	public JsonCodecConfig withPretty(boolean pretty) {
		this.pretty = pretty;
		return this;
	}

	/**
	 * Selects whether map entries keep their iteration order in the output. If unset,
	 * the entries are written sorted by key.
	 * @param preserveOrder true to keep the iteration order of maps
	 * @return this configuration
	 */
	public JsonCodecConfig withPreserveOrder(boolean preserveOrder) {
		this.preserveOrder = preserveOrder;
		return this;
	}

	/**
	 * Selects whether numbers read into untyped targets (such as {@code Object} or
	 * {@code Map<String, Object>} values) keep their full precision. Big decimals are then
	 * also written in plain notation.
	 * @param arbitraryPrecision true to read untyped numbers as big numbers
	 * @return this configuration
	 */
	public JsonCodecConfig withArbitraryPrecision(boolean arbitraryPrecision) {
		this.arbitraryPrecision = arbitraryPrecision;
		return this;
	}

	/**
	 * Selects whether floating-point numbers are converted by the exact JDK routines
	 * instead of the faster alternative ones.
	 * @param floatRoundtrip true to use the JDK conversion routines
	 * @return this configuration
	 */
	public JsonCodecConfig withFloatRoundtrip(boolean floatRoundtrip) {
		this.floatRoundtrip = floatRoundtrip;
		return this;
	}

	/**
	 * Lifts the nesting depth limit for both reading and writing. Deeply nested documents
	 * are then only limited by the thread stack size.
	 * @param unboundedDepth true to remove the nesting depth limit
	 * @return this configuration
	 */
	public JsonCodecConfig withUnboundedDepth(boolean unboundedDepth) {
		this.unboundedDepth = unboundedDepth;
		return this;
	}
}
