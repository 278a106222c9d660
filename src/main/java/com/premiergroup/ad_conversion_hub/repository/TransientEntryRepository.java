package com.premiergroup.ad_conversion_hub.repository;

import com.premiergroup.ad_conversion_hub.entity.TransientEntry;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TransientEntryRepository extends JpaRepository<TransientEntry, String> {
}
