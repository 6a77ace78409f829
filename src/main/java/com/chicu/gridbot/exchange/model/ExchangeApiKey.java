package com.chicu.gridbot.exchange.model;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.*;

/**
 * API-ключи биржи для конкретной сети. Заполняются дашбордом.
 */
@Entity
@Table(name = "exchange_api_keys")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "secretKey")
public class ExchangeApiKey {

    @EmbeddedId
    private ExchangeApiKeyId id;

    @Column(name = "public_key", nullable = false)
    private String publicKey;

    @Column(name = "secret_key", nullable = false)
    private String secretKey;
}
