package mgnrega.tracker.repository;

import mgnrega.tracker.model.District;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DistrictRepository extends MongoRepository<District, String> {

    List<District> findByStateCode(String stateCode, Sort sort);

    long countByStateCode(String stateCode);
}
