package com.example.clubadmin.repository;

import com.example.clubadmin.domain.Image;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ImageRepository extends JpaRepository<Image, Long> {
    List<Image> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);
}
