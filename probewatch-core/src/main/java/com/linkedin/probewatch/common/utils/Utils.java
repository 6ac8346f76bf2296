/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.probewatch.common.utils;

import java.util.Collection;
import java.util.Iterator;
import java.util.function.Supplier;


public final class Utils {

  private Utils() {

  }

  /**
   * Create a string representation of a collection joined by the given separator
   * @param list The collection of items
   * @param separator The separator
   * @param <T> The type of the items in the given collection.
   * @return The string representation.
   */
  public static <T> String join(Collection<T> list, String separator) {
    StringBuilder sb = new StringBuilder();
    Iterator<T> iter = list.iterator();
    while (iter.hasNext()) {
      sb.append(iter.next());
      if (iter.hasNext()) {
        sb.append(separator);
      }
    }
    return sb.toString();
  }

  /**
   * Checks that the specified object reference is not {@code null} and throws a customized {@link IllegalArgumentException}
   * if it is.
   *
   * @param obj The object reference to check for nullity.
   * @param message Detail message to be used in the event that an {@link IllegalArgumentException} is thrown.
   * @param <T> The type of the reference.
   * @return {@code obj} if not {@code null}.
   */
  public static <T> T validateNotNull(T obj, String message) {
    if (obj == null) {
      throw new IllegalArgumentException(message);
    }
    return obj;
  }

  /**
   * Same as {@link #validateNotNull(Object, String)}, but builds the message lazily.
   *
   * @param obj The object reference to check for nullity.
   * @param messageSupplier Supplier of the detail message.
   * @param <T> The type of the reference.
   * @return {@code obj} if not {@code null}.
   */
  public static <T> T validateNotNull(T obj, Supplier<String> messageSupplier) {
    if (obj == null) {
      throw new IllegalArgumentException(messageSupplier.get());
    }
    return obj;
  }
}
