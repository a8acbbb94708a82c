package com.williamcallahan.media_library.repository;

import com.williamcallahan.media_library.model.Library;

public interface LibraryRepository extends EntityRepository<Library> {
}
