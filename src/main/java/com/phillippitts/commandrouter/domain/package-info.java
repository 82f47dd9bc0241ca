/**
 * Immutable domain records shared by classification, workflow and delivery.
 *
 * <p>All types here are records or enums with validation in their compact constructors.
 * Collections passed in are defensively copied.
 */
package com.phillippitts.commandrouter.domain;
