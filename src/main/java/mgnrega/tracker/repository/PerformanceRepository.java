package mgnrega.tracker.repository;

import mgnrega.tracker.model.Performance;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface PerformanceRepository extends MongoRepository<Performance, String> {

    Optional<Performance> findFirstByStateCodeAndDistrictNameOrderByDataMonthDesc(String stateCode, String districtName);

    Optional<Performance> findByStateCodeAndDistrictNameAndDataMonth(String stateCode, String districtName, LocalDate dataMonth);

    boolean existsByStateCodeAndDistrictNameAndDataMonth(String stateCode, String districtName, LocalDate dataMonth);

    List<Performance> findTop12ByStateCodeAndDistrictNameOrderByDataMonthDesc(String stateCode, String districtName);
}
