package com.xksgroup.hlstranscoder.repo;

import com.xksgroup.hlstranscoder.model.Video;

import java.util.List;
import java.util.Optional;

public interface VideoRepository {

    void insert(Video video);

    Optional<Video> findById(String id);

    boolean existsById(String id);

    List<Video> findRecent(int limit);
}
