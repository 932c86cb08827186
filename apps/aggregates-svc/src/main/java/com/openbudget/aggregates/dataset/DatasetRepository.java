package com.openbudget.aggregates.dataset;

import java.util.Optional;

public interface DatasetRepository {

    Optional<Dataset> findById(String id);
}
