package org.javai.bali.config;

/**
 * Options shared by the tokenizer, parser, tree builder and formatter.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * BdnOptions options = BdnOptions.builder()
 *         .debug(true)
 *         .build();
 * }</pre>
 *
 * @param debug log a source excerpt for every error, and each ambiguity the parser resolves
 * @param indentation spaces per nesting level, used both when stripping and when emitting indentation
 * @param maxInlineSize largest size weight of a collection that the formatter still emits on one line
 */
public record BdnOptions(
		boolean debug,
		int indentation,
		int maxInlineSize
) {

	public static final int DEFAULT_INDENTATION = 4;

	public static final int DEFAULT_MAX_INLINE_SIZE = 60;

	public BdnOptions {
		if (indentation < 1) {
			throw new IllegalArgumentException("indentation must be at least 1");
		}
		if (maxInlineSize < 0) {
			throw new IllegalArgumentException("maxInlineSize must be non-negative");
		}
	}

	public static BdnOptions defaults() {
		return new BdnOptions(false, DEFAULT_INDENTATION, DEFAULT_MAX_INLINE_SIZE);
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		return new Builder()
				.debug(debug)
				.indentation(indentation)
				.maxInlineSize(maxInlineSize);
	}

	/**
	 * Builder for {@link BdnOptions}.
	 */
	public static class Builder {
		private boolean debug = false;
		private int indentation = DEFAULT_INDENTATION;
		private int maxInlineSize = DEFAULT_MAX_INLINE_SIZE;

		private Builder() {}

		public Builder debug(boolean debug) {
			this.debug = debug;
			return this;
		}

		public Builder indentation(int indentation) {
			this.indentation = indentation;
			return this;
		}

		/**
		 * Sets the size weight above which arrays, tables and parameters are emitted one item per line.
		 *
		 * @param maxInlineSize the threshold (must be non-negative)
		 * @return this builder
		 */
		public Builder maxInlineSize(int maxInlineSize) {
			this.maxInlineSize = maxInlineSize;
			return this;
		}

		public BdnOptions build() {
			return new BdnOptions(debug, indentation, maxInlineSize);
		}
	}
}
