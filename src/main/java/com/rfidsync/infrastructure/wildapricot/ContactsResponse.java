package com.rfidsync.infrastructure.wildapricot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.rfidsync.domain.model.Contact;

import java.util.List;

/**
 * Cuerpo de GET /accounts/{id}/contacts con $async=false.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record ContactsResponse(@JsonProperty("Contacts") List<Contact> contacts) {
}
