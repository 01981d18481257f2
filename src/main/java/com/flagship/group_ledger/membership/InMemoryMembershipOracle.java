package com.flagship.group_ledger.membership;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryMembershipOracle implements MembershipOracle {

    private final Map<String, Set<String>> membersByGroup = new ConcurrentHashMap<>();

    public InMemoryMembershipOracle addMembers(String groupId, Collection<String> memberIds) {
        membersByGroup.computeIfAbsent(groupId, g -> ConcurrentHashMap.newKeySet()).addAll(memberIds);
        return this;
    }

    public InMemoryMembershipOracle addMembers(String groupId, String... memberIds) {
        return addMembers(groupId, Set.of(memberIds));
    }

    public void removeMember(String groupId, String memberId) {
        Set<String> members = membersByGroup.get(groupId);
        if (members != null) {
            members.remove(memberId);
        }
    }

    @Override
    public boolean isMember(String groupId, String memberId) {
        Set<String> members = membersByGroup.get(groupId);
        return members != null && members.contains(memberId);
    }
}
