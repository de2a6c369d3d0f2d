package com.maintenance.service;

import com.maintenance.dto.FeatureResponse;
import com.maintenance.model.TrainingFeature;
import com.maintenance.repository.ServingFeatureRepository;
import com.maintenance.repository.TrainingFeatureRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read side of the feature stores.
 */
@Service
@RequiredArgsConstructor
public class FeatureQueryService {

    private final ServingFeatureRepository servingRepository;
    private final TrainingFeatureRepository trainingRepository;

    @Transactional(readOnly = true)
    public Optional<FeatureResponse> getLatest(String machineId) {
        return servingRepository.findById(machineId).map(FeatureResponse::from);
    }

    @Transactional(readOnly = true)
    public List<FeatureResponse> listLatest() {
        return servingRepository.findAllByOrderByMachineIdAsc().stream()
            .map(FeatureResponse::from)
            .collect(Collectors.toList());
    }

    /**
     * Training rows of a machine, oldest window first.
     */
    @Transactional(readOnly = true)
    public List<TrainingFeature> getHistory(String machineId) {
        return trainingRepository.findByMachineIdOrderByWindowStartAsc(machineId);
    }
}
