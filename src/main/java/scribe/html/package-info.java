// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Factory functions for building HTML trees tersely.
 */
package scribe.html;
