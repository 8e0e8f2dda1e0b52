package com.vidnyan.govern.application.service;

import com.vidnyan.govern.application.port.in.ManageWaiversUseCase;
import com.vidnyan.govern.application.port.out.WaiverStore;
import com.vidnyan.govern.config.GovernProperties;
import com.vidnyan.govern.domain.waiver.Waiver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class WaiverApplicationService implements ManageWaiversUseCase {

    private final WaiverStore waiverStore;
    private final GovernProperties properties;
    private final Clock clock;

    @Override
    public Waiver add(WaiverRequest request) {
        Integer days = request.expiresInDays() != null
                ? request.expiresInDays()
                : properties.getWaiver().getDefaultExpiryDays();
        Waiver waiver = Waiver.create(
                request.controlOrPolicyId(),
                request.resourceId(),
                request.reason(),
                request.approvedBy(),
                days,
                clock.instant());

        Waiver stored = waiverStore.add(waiver);
        log.info("Waiver {} granted on {} for {} by {} until {}",
                stored.id(), stored.controlOrPolicyId(), stored.resourceId(), stored.approvedBy(), stored.expiresAt());
        return stored;
    }

    @Override
    public boolean remove(String waiverId) {
        boolean removed = waiverStore.remove(waiverId);
        if (removed) {
            log.info("Waiver {} revoked", waiverId);
        }
        return removed;
    }

    @Override
    public List<Waiver> listActive() {
        return waiverStore.listActive(clock.instant());
    }

    @Override
    public List<Waiver> list() {
        return waiverStore.list();
    }
}
