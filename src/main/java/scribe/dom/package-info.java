// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The mutable DOM tree, its composition protocol, serialization to HTML and structural search.
 */
package scribe.dom;
