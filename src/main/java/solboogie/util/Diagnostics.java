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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import solboogie.core.SourceNode;

/**
 * The outgoing mailbox for recoverable translation errors. Errors are only ever
 * appended, and are returned in the order in which they were reported so that
 * diagnostics for a translation unit are deterministic.
 */
public class Diagnostics {
	private static final Logger logger = LoggerFactory.getLogger(Diagnostics.class);

	private final List<SyntaxError> errors = new ArrayList<>();

	/**
	 * Report an error associated with a given source node.
	 *
	 * @param element Node responsible for the error, or <code>null</code>.
	 * @param message Description of the error.
	 */
	public synchronized void report(SourceNode element, String message) {
		SyntaxError error = new SyntaxError(message, element);
		logger.warn("{}", error);
		errors.add(error);
	}

	/**
	 * Check whether any errors have been reported. When this holds, a successful
	 * verification result must not be claimed for the affected contract.
	 *
	 * @return
	 */
	public synchronized boolean hasErrors() {
		return !errors.isEmpty();
	}

	public synchronized int size() {
		return errors.size();
	}

	public synchronized List<SyntaxError> getErrors() {
		return Collections.unmodifiableList(new ArrayList<>(errors));
	}
}
