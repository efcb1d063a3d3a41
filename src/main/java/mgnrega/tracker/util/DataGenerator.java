package mgnrega.tracker.util;

import lombok.extern.slf4j.Slf4j;
import mgnrega.tracker.config.TrackerProperties;
import mgnrega.tracker.model.District;
import mgnrega.tracker.repository.DistrictRepository;
import mgnrega.tracker.service.SyntheticDataService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Seeds the district reference data on startup, then makes sure every district has a
 * performance row for the current data month. Safe to run against a populated database.
 */
@Component
@Order(1)
@Slf4j
public class DataGenerator implements CommandLineRunner {

    static final List<String> MAHARASHTRA_DISTRICTS = Arrays.asList(
            "अहमदनगर (Ahmednagar)", "अकोला (Akola)", "अमरावती (Amravati)",
            "छत्रपति संभाजीनगर (Chh. Sambhajinagar)",
            "भंडारा (Bhandara)", "बुलढाणा (Buldhana)",
            "चंद्रपूर (Chandrapur)", "धुले (Dhule)", "गड़चिरोली (Gadchiroli)",
            "गोंदिया (Gondia)", "हिंगोली (Hingoli)", "जलगांव (Jalgaon)",
            "जालना (Jalna)", "कोल्हापुर (Kolhapur)", "लातूर (Latur)",
            "मुंबई उपनगर (Mumbai Sub)", "नागपुर (Nagpur)", "नांदेड़ (Nanded)",
            "नंदुरबार (Nandurbar)", "नासिक (Nashik)", "धाराशिव (Dharashiv)",
            "परभणी (Parbhani)", "पुणे (Pune)", "रायगड़ (Raigad)",
            "रत्नागिरी (Ratnagiri)", "सांगली (Sangli)", "सतारा (Satara)",
            "सिंधुदुर्ग (Sindhudurg)", "सोलापुर (Solapur)", "ठाणे (Thane)",
            "वर्धा (Wardha)", "वाशिम (Washim)", "यवतमाल (Yavatmal)",
            "पालघर (Palghar)"
    );

    private final DistrictRepository districtRepository;
    private final SyntheticDataService syntheticDataService;
    private final TrackerProperties properties;
    private final Clock clock;

    @Autowired
    public DataGenerator(DistrictRepository districtRepository, SyntheticDataService syntheticDataService,
                         TrackerProperties properties, Clock clock) {
        this.districtRepository = districtRepository;
        this.syntheticDataService = syntheticDataService;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(String... args) {
        if (!properties.getSeed().isEnabled()) {
            log.info("Seeding disabled (mgnrega.seed.enabled=false)");
            return;
        }

        int seeded = seedDistricts();
        log.info("Seeded {} new districts for {}", seeded, properties.getState().getCode());

        syntheticDataService.runSync("startup");
    }

    /**
     * Inserts every configured district that is not stored yet.
     *
     * @return number of rows inserted
     */
    int seedDistricts() {
        TrackerProperties.State state = properties.getState();
        Set<String> wanted = new LinkedHashSet<>(MAHARASHTRA_DISTRICTS);
        Set<String> existing = districtRepository.findByStateCode(state.getCode(), Sort.unsorted()).stream()
                .map(District::getDistrictName)
                .collect(Collectors.toSet());

        int inserted = 0;
        for (String name : wanted) {
            if (existing.contains(name)) {
                continue;
            }
            District district = District.builder()
                    .stateCode(state.getCode())
                    .stateName(state.getName())
                    .districtName(name)
                    .createdAt(clock.instant())
                    .build();
            try {
                districtRepository.insert(district);
                inserted++;
            } catch (DuplicateKeyException e) {
                log.warn("District {} already exists, skipping insert", name);
            }
        }
        return inserted;
    }
}
