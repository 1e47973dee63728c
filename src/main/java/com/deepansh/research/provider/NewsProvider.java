package com.deepansh.research.provider;

import java.util.List;

public interface NewsProvider {

    /** Recent news for a free-text query, newest first. Empty when nothing matches. */
    List<NewsArticle> search(String query);
}
