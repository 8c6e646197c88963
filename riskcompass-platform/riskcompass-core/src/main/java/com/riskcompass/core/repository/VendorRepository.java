package com.riskcompass.core.repository;

import com.riskcompass.core.domain.Vendor;
import com.riskcompass.core.domain.Vendor.VendorStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface VendorRepository extends JpaRepository<Vendor, UUID> {

    List<Vendor> findByStatusOrderByNameAsc(VendorStatus status);
}
