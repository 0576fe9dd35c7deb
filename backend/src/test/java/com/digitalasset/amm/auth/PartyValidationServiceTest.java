// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.auth;

import com.digitalasset.amm.common.errors.ValidationError;
import com.digitalasset.amm.config.PoolProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PartyValidationServiceTest {

    private final PartyValidationService service = new PartyValidationService(new PoolProperties());

    @Test
    void testAcceptsAndTrims() {
        assertThat(service.validateFormat("  alice::1220ab  ").getValueUnsafe()).isEqualTo("alice::1220ab");
        assertThat(service.validateFormat("trader-1.desk_2").isOk()).isTrue();
    }

    @Test
    void testMissingPartyIsAnIdentityError() {
        ValidationError missing = (ValidationError) service.validateFormat(null).getErrorUnsafe();
        assertThat(missing.type()).isEqualTo(ValidationError.Type.IDENTITY);
        assertThat(missing.httpStatus()).isEqualTo(401);
        assertThat(service.validateFormat("   ").isErr()).isTrue();
    }

    @Test
    void testMalformedPartyIsARequestError() {
        ValidationError bad = (ValidationError) service.validateFormat("alice bob").getErrorUnsafe();
        assertThat(bad.type()).isEqualTo(ValidationError.Type.REQUEST);
        assertThat(service.validateFormat("a".repeat(256)).isErr()).isTrue();
    }

    @Test
    void testPoolAccountCannotCall() {
        assertThat(service.resolveCaller("amm-pool").isErr()).isTrue();
        assertThat(service.validateFormat("amm-pool").isOk()).isTrue();
    }
}
