package com.example.crmaccess.access.service;

import com.example.crmaccess.directory.DirectoryStore;
import com.example.crmaccess.directory.model.CrmModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static com.example.crmaccess.util.DirectoryTestBuilders.ORG_ID;
import static com.example.crmaccess.util.DirectoryTestBuilders.aContact;
import static com.example.crmaccess.util.DirectoryTestBuilders.aUser;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RecordOwnershipExtractor")
class RecordOwnershipExtractorTest {

    @Mock
    private DirectoryStore directoryStore;

    private RecordOwnershipExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new RecordOwnershipExtractor(directoryStore);
    }

    @Test
    @DisplayName("should use stored owner and organization without further lookups")
    void shouldUseStoredFields() {
        StepVerifier.create(extractor.extract(aContact("c1").ownedBy("u1").withLinkedUser("local-u9").build()))
                .assertNext(ownership -> {
                    assertThat(ownership.ownerExternalId()).isEqualTo("u1");
                    assertThat(ownership.organizationId()).isEqualTo(ORG_ID);
                })
                .verifyComplete();

        verifyNoInteractions(directoryStore);
    }

    @Test
    @DisplayName("should fill missing parts from the linked user without overwriting stored ones")
    void shouldFillFromLinkedUser() {
        when(directoryStore.findUserById("local-u1"))
                .thenReturn(Mono.just(aUser("u1").withOrganizationId("org-from-user").build()));

        StepVerifier.create(extractor.extract(aContact("c1").withLinkedUser("local-u1").build()))
                .assertNext(ownership -> {
                    assertThat(ownership.ownerExternalId()).isEqualTo("u1");
                    assertThat(ownership.organizationId()).isEqualTo(ORG_ID);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should look the record up by its CRM id when the owner is still unknown")
    void shouldFallBackToExternalRecord() {
        when(directoryStore.findRecordByExternalId(CrmModule.CONTACTS, "crm-1"))
                .thenReturn(Mono.just(aContact("c-other").withExternalId("crm-1").withLinkedUser("local-u2").build()));
        when(directoryStore.findUserById("local-u2"))
                .thenReturn(Mono.just(aUser("u2").build()));

        StepVerifier.create(extractor.extract(aContact("c1").withExternalId("crm-1").withoutOrganization().build()))
                .assertNext(ownership -> {
                    assertThat(ownership.ownerExternalId()).isEqualTo("u2");
                    assertThat(ownership.organizationId()).isEqualTo(ORG_ID);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should not repeat the linked user lookup for the same user")
    void shouldNotRepeatLinkedUserLookup() {
        when(directoryStore.findUserById("local-u1")).thenReturn(Mono.empty());
        when(directoryStore.findRecordByExternalId(CrmModule.CONTACTS, "crm-1"))
                .thenReturn(Mono.just(aContact("c1").withExternalId("crm-1").withLinkedUser("local-u1").build()));

        StepVerifier.create(extractor.extract(aContact("c1").withExternalId("crm-1").withLinkedUser("local-u1").build()))
                .assertNext(ownership -> assertThat(ownership.hasOwner()).isFalse())
                .verifyComplete();

        verify(directoryStore).findUserById("local-u1");
    }

    @Test
    @DisplayName("should return partial ownership when every fallback comes up empty")
    void shouldReturnPartialOwnership() {
        StepVerifier.create(extractor.extract(aContact("c1").build()))
                .assertNext(ownership -> {
                    assertThat(ownership.hasOwner()).isFalse();
                    assertThat(ownership.organizationId()).isEqualTo(ORG_ID);
                })
                .verifyComplete();

        verify(directoryStore, never()).findRecordByExternalId(CrmModule.CONTACTS, null);
    }
}
