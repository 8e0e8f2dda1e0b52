package com.vidnyan.govern.application.port.out;

import com.vidnyan.govern.domain.waiver.Waiver;
import com.vidnyan.govern.domain.waiver.WaiverLookup;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Port for waiver persistence. Holds at most one waiver per
 * (control or policy, resource) pair; adding replaces.
 */
public interface WaiverStore extends WaiverLookup {

    Waiver add(Waiver waiver);

    boolean remove(String waiverId);

    Optional<Waiver> get(String waiverId);

    /**
     * Every stored waiver, expired ones included.
     */
    List<Waiver> list();

    List<Waiver> listActive(Instant now);
}
