package com.automate.ImageScan.repository;

import com.automate.ImageScan.entity.ScansEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ScansRepository extends JpaRepository<ScansEntity, Long> {

    List<ScanListView> findAllByOrderByIdAsc();

}
