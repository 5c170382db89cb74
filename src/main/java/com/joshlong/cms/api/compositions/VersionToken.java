package com.joshlong.cms.api.compositions;

import java.util.Comparator;

/**
 * how fresh a composed article is. {@code lastModified} is the newest timestamp among
 * the article, its atoms and their types, so edits move it forward. {@code fingerprint}
 * also covers the order and membership of the atoms, which reordering or removing an
 * atom changes without touching any timestamp.
 */
public record VersionToken(long lastModified, String fingerprint) implements Comparable<VersionToken> {

	private static final Comparator<VersionToken> ORDER = Comparator.comparingLong(VersionToken::lastModified)
		.thenComparing(VersionToken::fingerprint);

	@Override
	public int compareTo(VersionToken other) {
		return ORDER.compare(this, other);
	}

	@Override
	public String toString() {
		return this.lastModified + "-" + this.fingerprint;
	}

}
