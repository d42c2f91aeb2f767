///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
/**
 * A package for running API documentation tests.
 * <p>
 * This is distinct from the package that holds the unit-under-test to ensure that the recommended usage doesn't
 * inadvertently use a package-private method.
 * </p>
 */
package org.scharp.bannertab.javadoc;
