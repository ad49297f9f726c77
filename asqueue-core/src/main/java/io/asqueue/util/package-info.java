/**
 * Small internal helpers shared by the scheduled components.
 */
package io.asqueue.util;
