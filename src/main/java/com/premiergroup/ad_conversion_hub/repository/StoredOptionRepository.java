package com.premiergroup.ad_conversion_hub.repository;

import com.premiergroup.ad_conversion_hub.entity.StoredOption;
import org.springframework.data.jpa.repository.JpaRepository;

public interface StoredOptionRepository extends JpaRepository<StoredOption, String> {
}
