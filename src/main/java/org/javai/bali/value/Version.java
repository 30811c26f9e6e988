package org.javai.bali.value;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A version such as {@code v1.2.3}. Every level is a positive integer of any size.
 */
public record Version(List<BigInteger> levels) implements Comparable<Version> {

	public Version {
		if (levels == null || levels.isEmpty()) {
			throw new IllegalArgumentException("A version requires at least one level");
		}
		for (BigInteger level : levels) {
			if (level == null || level.signum() < 1) {
				throw new IllegalArgumentException("Version levels must be positive: " + levels);
			}
		}
		levels = List.copyOf(levels);
	}

	public static Version of(long... levels) {
		List<BigInteger> values = new ArrayList<>();
		for (long level : levels) {
			values.add(BigInteger.valueOf(level));
		}
		return new Version(values);
	}

	/**
	 * @param literal version text including the leading {@code v}
	 */
	public static Version parse(String literal) {
		if (literal == null || !literal.startsWith("v") || literal.length() < 2) {
			throw new IllegalArgumentException("Not a version literal: " + literal);
		}
		List<BigInteger> levels = new ArrayList<>();
		for (String level : literal.substring(1).split("\\.", -1)) {
			try {
				levels.add(new BigInteger(level));
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Not a version literal: " + literal, e);
			}
		}
		return new Version(levels);
	}

	public int size() {
		return levels.size();
	}

	/**
	 * Increments the last level.
	 */
	public Version nextVersion() {
		return nextVersion(levels.size());
	}

	/**
	 * Increments the given level (numbered from 1) and drops any deeper levels. A level past the
	 * last one appends a new level of 1.
	 */
	public Version nextVersion(int level) {
		if (level < 1) {
			throw new IllegalArgumentException("Version levels are numbered from 1: " + level);
		}
		List<BigInteger> next = new ArrayList<>(levels);
		int index = level - 1;
		if (index < next.size()) {
			next.set(index, next.get(index).add(BigInteger.ONE));
			next.subList(index + 1, next.size()).clear();
		} else {
			next.add(BigInteger.ONE);
		}
		return new Version(next);
	}

	/**
	 * Whether {@code next} may directly follow this version: either one level is incremented by
	 * one and nothing follows it, or a new level of 1 is appended.
	 */
	public boolean isValidNextVersion(Version next) {
		List<BigInteger> nextLevels = next.levels();
		int index = 0;
		while (index < levels.size() && index < nextLevels.size()) {
			BigInteger current = levels.get(index);
			BigInteger candidate = nextLevels.get(index);
			if (!current.equals(candidate)) {
				return candidate.equals(current.add(BigInteger.ONE)) && nextLevels.size() == index + 1;
			}
			index++;
		}
		return nextLevels.size() == index + 1 && nextLevels.get(index).equals(BigInteger.ONE);
	}

	@Override
	public int compareTo(Version other) {
		List<BigInteger> otherLevels = other.levels();
		for (int i = 0; i < levels.size() && i < otherLevels.size(); i++) {
			int result = levels.get(i).compareTo(otherLevels.get(i));
			if (result != 0) {
				return result;
			}
		}
		return Integer.compare(levels.size(), otherLevels.size());
	}

	@Override
	public String toString() {
		return levels.stream().map(String::valueOf).collect(Collectors.joining(".", "v", ""));
	}
}
