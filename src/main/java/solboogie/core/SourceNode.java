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
 * A node of the Solidity AST which an operation being translated originates
 * from. This is used only to attribute diagnostics and generated Boogie back
 * to the source.
 */
public interface SourceNode {

	/**
	 * Get the location of this node in the source, or <code>null</code> if it is
	 * not known.
	 *
	 * @return
	 */
	public SourceLocation getLocation();
}
