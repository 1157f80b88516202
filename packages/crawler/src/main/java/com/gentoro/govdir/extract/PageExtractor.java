package com.gentoro.govdir.extract;

import com.gentoro.govdir.exception.ExtractionException;

/**
 * Maps the raw markup of one page type to candidate field values. Implementations know nothing
 * about the hierarchy the page belongs to and are safe to call from any thread.
 *
 * @param <T> candidate shape produced for the page type
 */
public interface PageExtractor<T> {

  PageType pageType();

  /**
   * @param html raw page markup
   * @param pageUrl URL the markup was loaded from, used to resolve relative links
   * @throws ExtractionException when the markup does not have the structure this page type needs
   */
  T extract(String html, String pageUrl);
}
