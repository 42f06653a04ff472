@NullMarked
package org.springaicommunity.github.harvester.cli;

import org.jspecify.annotations.NullMarked;
