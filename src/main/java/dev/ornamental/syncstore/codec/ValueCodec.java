package dev.ornamental.syncstore.codec;

import dev.ornamental.syncstore.ValueDecodingException;
import dev.ornamental.syncstore.ValueEncodingException;

/**
 * Converts values of a type to and from their stored byte representation.<br>
 * The implementations must be thread-safe.
 * @param <T> the type of the converted values
 */
public interface ValueCodec<T> {

	/**
	 * Produces the stored representation of a value.
	 * @param value the value to encode
	 * @return the complete contents of the backing file for the value
	 * @throws ValueEncodingException if the value cannot be represented
	 */
	byte[] encode(T value) throws ValueEncodingException;

	/**
	 * Restores a value from its stored representation.
	 * @param bytes the complete contents of a backing file
	 * @return the decoded value
	 * @throws ValueDecodingException if the bytes are not a valid encoding of a value of the type
	 */
	T decode(byte[] bytes) throws ValueDecodingException;
}
