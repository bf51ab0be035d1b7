package com.zerotrust.access.risk.history;

public interface BehaviorHistory {

    BehaviorProfile profile(String userId);
}
