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
package solboogie.util;

import solboogie.core.SourceLocation;
import solboogie.core.SourceNode;

/**
 * Signals a broken precondition between translation components, for example
 * asking for the bit width of a non bit-precise type. Unlike a
 * {@link SyntaxError}, this is never recovered from: translation stops rather
 * than producing an unsound verification artifact.
 *
 */
@SuppressWarnings("serial")
public class InternalFailure extends RuntimeException {
	protected final SourceNode location;

	public InternalFailure(String message) {
		this(message, null);
	}

	/**
	 * Record an internal failure, with a source node.
	 *
	 * @param message
	 * @param loc can be null if not known.
	 */
	public InternalFailure(String message, SourceNode loc) {
		super(message);
		location = loc;
	}

	public SourceNode getElement() {
		return location;
	}

	@Override
	public String getMessage() {
		String msg = super.getMessage();
		if (location != null) {
			SourceLocation src = location.getLocation();
			if (src != null) {
				return msg + " at " + src;
			}
		}
		return msg;
	}
}
