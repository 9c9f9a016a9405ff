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
 * A recoverable translation error, such as an operator which is not supported
 * by the chosen arithmetic encoding. Errors are attributed to the source node
 * which caused them, when one is known.
 */
public class SyntaxError {
	private final String message;
	private final SourceNode element;

	public SyntaxError(String message, SourceNode element) {
		this.message = message;
		this.element = element;
	}

	public String getMessage() {
		return message;
	}

	/**
	 * Get the source node this error is associated with, or <code>null</code>.
	 *
	 * @return
	 */
	public SourceNode getElement() {
		return element;
	}

	public SourceLocation getLocation() {
		return element == null ? null : element.getLocation();
	}

	@Override
	public String toString() {
		SourceLocation loc = getLocation();
		if (loc == null) {
			return "error: " + message;
		} else {
			return loc + ": error: " + message;
		}
	}
}
