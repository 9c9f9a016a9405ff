// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package solboogie.core;

/**
 * Identifies a position within a given source file. Lines and columns start
 * from 1.
 */
public final class SourceLocation {
	private final String source;
	private final int line;
	private final int column;

	public SourceLocation(String source, int line, int column) {
		if (source == null || line < 1 || column < 1) {
			throw new IllegalArgumentException("invalid source location");
		}
		this.source = source;
		this.line = line;
		this.column = column;
	}

	public String getSource() {
		return source;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof SourceLocation) {
			SourceLocation l = (SourceLocation) o;
			return source.equals(l.source) && line == l.line && column == l.column;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return source.hashCode() ^ (line * 31) ^ column;
	}

	@Override
	public String toString() {
		return source + ":" + line + ":" + column;
	}
}
