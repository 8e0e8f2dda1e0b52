package com.vidnyan.govern.adapter.out.store;

import com.vidnyan.govern.application.port.out.PolicyRepository;
import com.vidnyan.govern.domain.policy.Policy;
import com.vidnyan.govern.domain.policy.PolicyValidator;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Policies held in memory. Every save is validated first.
 */
public class InMemoryPolicyRepository implements PolicyRepository {

    protected final Map<String, Policy> policies = new ConcurrentHashMap<>();
    protected final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public List<Policy> list(PolicyFilter filter) {
        lock.readLock().lock();
        try {
            return policies.values().stream()
                    .filter(filter::test)
                    .sorted(Comparator.comparing(Policy::id))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Policy> findById(String policyId) {
        return policyId == null ? Optional.empty() : Optional.ofNullable(policies.get(policyId));
    }

    @Override
    public Policy save(Policy policy) {
        PolicyValidator.validate(policy);
        lock.writeLock().lock();
        try {
            Policy previous = policies.put(policy.id(), policy);
            try {
                persist(policy);
            } catch (RuntimeException e) {
                if (previous == null) {
                    policies.remove(policy.id());
                } else {
                    policies.put(policy.id(), previous);
                }
                throw e;
            }
            return policy;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean delete(String policyId) {
        lock.writeLock().lock();
        try {
            Policy removed = policies.remove(policyId);
            if (removed == null) {
                return false;
            }
            try {
                unpersist(policyId);
            } catch (RuntimeException e) {
                policies.put(policyId, removed);
                throw e;
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    protected void persist(Policy policy) {
    }

    protected void unpersist(String policyId) {
    }
}
