package org.javai.bali.value;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;

class VersionTest {

	@Test
	void parseAndPrint() {
		Version version = Version.parse("v1.12.3");

		assertThat(version.levels()).containsExactly(BigInteger.ONE, BigInteger.valueOf(12), BigInteger.valueOf(3));
		assertThat(version.size()).isEqualTo(3);
		assertThat(version).hasToString("v1.12.3");
	}

	@Test
	void levelsAreNotLimitedToInt() {
		Version version = Version.parse("v3000000000.99999999999999999999");

		assertThat(version.levels().get(1)).isEqualTo(new BigInteger("99999999999999999999"));
		assertThat(version.nextVersion()).hasToString("v3000000000.100000000000000000000");
		assertThat(version).isGreaterThan(Version.of(2999999999L, 1));
		assertThat(version.isValidNextVersion(Version.parse("v3000000001"))).isTrue();
	}

	@Test
	void levelsMustBePositive() {
		assertThatThrownBy(() -> Version.of(1, 0)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new Version(List.of())).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> Version.parse("1.2")).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> Version.parse("v1..2")).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void ordering() {
		assertThat(Version.of(1, 2)).isLessThan(Version.of(1, 10));
		assertThat(Version.of(2)).isGreaterThan(Version.of(1, 9, 9));
		assertThat(Version.of(1, 2)).isLessThan(Version.of(1, 2, 1));
		assertThat(Version.of(1, 2).compareTo(Version.parse("v1.2"))).isZero();
	}

	@Test
	void nextVersionIncrementsLastLevel() {
		assertThat(Version.of(1, 2).nextVersion()).isEqualTo(Version.of(1, 3));
	}

	@Test
	void nextVersionAtLevel() {
		Version version = Version.of(1, 2, 3);

		assertThat(version.nextVersion(1)).isEqualTo(Version.of(2));
		assertThat(version.nextVersion(2)).isEqualTo(Version.of(1, 3));
		assertThat(version.nextVersion(4)).isEqualTo(Version.of(1, 2, 3, 1));
		assertThatThrownBy(() -> version.nextVersion(0)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void validNextVersions() {
		Version current = Version.of(1, 2);

		assertThat(current.isValidNextVersion(Version.of(1, 3))).isTrue();
		assertThat(current.isValidNextVersion(Version.of(2))).isTrue();
		assertThat(current.isValidNextVersion(Version.of(1, 2, 1))).isTrue();
	}

	@Test
	void invalidNextVersions() {
		Version current = Version.of(1, 2);

		assertThat(current.isValidNextVersion(Version.of(1, 4))).isFalse();
		assertThat(current.isValidNextVersion(Version.of(1, 3, 1))).isFalse();
		assertThat(current.isValidNextVersion(Version.of(1, 2))).isFalse();
		assertThat(current.isValidNextVersion(Version.of(1, 2, 2))).isFalse();
		assertThat(current.isValidNextVersion(Version.of(1, 1))).isFalse();
	}
}
