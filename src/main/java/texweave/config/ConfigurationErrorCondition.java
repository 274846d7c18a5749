// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.config;

import texweave.util.condition.Condition;

/**
 * Signaled when a configuration file is malformed JSON or not a valid configuration.
 */
public final class ConfigurationErrorCondition extends Condition {
    public ConfigurationErrorCondition(final String source, final String message) {
        super(source + ": " + message);
    }
}
