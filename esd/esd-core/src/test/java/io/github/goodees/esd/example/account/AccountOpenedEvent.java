package io.github.goodees.esd.example.account;

/*-
 * #%L
 * esd
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

public class AccountOpenedEvent {
    private final UUID accountId;
    private final String owner;
    private final long initialBalance;

    @JsonCreator
    public AccountOpenedEvent(@JsonProperty("accountId") UUID accountId, @JsonProperty("owner") String owner,
            @JsonProperty("initialBalance") long initialBalance) {
        this.accountId = accountId;
        this.owner = owner;
        this.initialBalance = initialBalance;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public String getOwner() {
        return owner;
    }

    public long getInitialBalance() {
        return initialBalance;
    }
}
