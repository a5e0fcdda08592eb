package com.e2eq.docmap.movies;

import com.e2eq.docmap.geo.Point;
import com.e2eq.docmap.mapping.DocumentEntity;

/**
 * A value that can be embedded as a location under any parent. The parent alone names the
 * field holding it.
 */
public interface Locatable {

    String getFormattedAddress();

    Point getGeolocation();

    /**
     * The entity embedding this value, or {@code null} when it is stored on its own.
     */
    DocumentEntity getEmbeddedParent();
}
