package com.example.crmaccess.directory;

import com.example.crmaccess.directory.document.ContactDoc;
import com.example.crmaccess.directory.document.CrmProfileDoc;
import com.example.crmaccess.directory.document.CrmRoleDoc;
import com.example.crmaccess.directory.document.CrmUserDoc;
import com.example.crmaccess.directory.document.SharingRuleDoc;
import com.example.crmaccess.directory.model.ContactRecord;
import com.example.crmaccess.directory.model.CrmModule;
import com.example.crmaccess.directory.model.ModulePermission;
import com.example.crmaccess.directory.repository.ContactRepository;
import com.example.crmaccess.directory.repository.CrmProfileRepository;
import com.example.crmaccess.directory.repository.CrmRoleRepository;
import com.example.crmaccess.directory.repository.CrmUserRepository;
import com.example.crmaccess.directory.repository.SharingRuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MongoDirectoryStore")
class MongoDirectoryStoreTest {

    @Mock
    private ContactRepository contactRepository;

    @Mock
    private CrmUserRepository userRepository;

    @Mock
    private CrmProfileRepository profileRepository;

    @Mock
    private CrmRoleRepository roleRepository;

    @Mock
    private SharingRuleRepository sharingRuleRepository;

    private MongoDirectoryStore store;

    @BeforeEach
    void setUp() {
        store = new MongoDirectoryStore(
                contactRepository, userRepository, profileRepository, roleRepository, sharingRuleRepository);
    }

    @Nested
    @DisplayName("Records")
    class Records {

        @Test
        @DisplayName("should map a contact document to a contact record")
        void shouldMapContact() {
            when(contactRepository.findById("c1")).thenReturn(Mono.just(ContactDoc.builder()
                    .id("c1")
                    .externalId("crm-1")
                    .userId("local-u1")
                    .ownerExternalId("u1")
                    .organizationId("org-1")
                    .firstName("Ada")
                    .build()));

            StepVerifier.create(store.findRecordByPrimaryId(CrmModule.CONTACTS, "c1"))
                    .assertNext(record -> assertThat(record)
                            .isEqualTo(new ContactRecord("c1", "crm-1", "local-u1", "u1", "org-1")))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should complete empty when no contact has the CRM id")
        void shouldCompleteEmptyForUnknownExternalId() {
            when(contactRepository.findByExternalId("crm-x")).thenReturn(Mono.empty());

            StepVerifier.create(store.findRecordByExternalId(CrmModule.CONTACTS, "crm-x"))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Directory entities")
    class DirectoryEntities {

        @Test
        @DisplayName("should map users, roles and profiles")
        void shouldMapEntities() {
            when(userRepository.findByOrganizationIdAndActiveTrueOrderByCreatedAtAscIdAsc("org-1"))
                    .thenReturn(Flux.just(CrmUserDoc.builder()
                            .id("local-u1").externalId("u1").organizationId("org-1")
                            .active(true).profileId("p1").roleId("r1")
                            .build()));
            when(roleRepository.findByOrganizationIdAndActiveTrueOrderByCreatedAtAscIdAsc("org-1"))
                    .thenReturn(Flux.just(CrmRoleDoc.builder()
                            .id("r1").displayLabel("CEO").organizationId("org-1").active(true)
                            .build()));
            when(profileRepository.findById("p1"))
                    .thenReturn(Mono.just(CrmProfileDoc.builder()
                            .id("p1").displayLabel("Sales").organizationId("org-1")
                            .permissions(List.of(new CrmProfileDoc.PermissionEntry("Contacts", true)))
                            .build()));

            StepVerifier.create(store.listActiveUsers("org-1"))
                    .assertNext(user -> {
                        assertThat(user.externalId()).isEqualTo("u1");
                        assertThat(user.active()).isTrue();
                        assertThat(user.roleId()).isEqualTo("r1");
                    })
                    .verifyComplete();

            StepVerifier.create(store.listRoles("org-1"))
                    .assertNext(role -> assertThat(role.reportsToId()).isNull())
                    .verifyComplete();

            StepVerifier.create(store.getProfileWithPermissions("p1"))
                    .assertNext(profile -> assertThat(profile.permissions())
                            .containsExactly(new ModulePermission("Contacts", true)))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should map a profile without permissions to an empty list")
        void shouldMapProfileWithoutPermissions() {
            when(profileRepository.findById("p2"))
                    .thenReturn(Mono.just(CrmProfileDoc.builder().id("p2").organizationId("org-1").build()));

            StepVerifier.create(store.getProfileWithPermissions("p2"))
                    .assertNext(profile -> assertThat(profile.permissions()).isEmpty())
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("getSharingRule")
    class GetSharingRule {

        @Test
        @DisplayName("should pick the oldest of several active rules")
        void shouldPickOldestRule() {
            when(sharingRuleRepository.findByOrganizationIdAndModuleNameAndActiveTrueOrderByCreatedAtAscIdAsc(
                    "org-1", "Contacts"))
                    .thenReturn(Flux.just(
                            ruleDoc("rule-old", "private", "2023-01-01T00:00:00Z"),
                            ruleDoc("rule-new", "public", "2024-01-01T00:00:00Z")));

            StepVerifier.create(store.getSharingRule("org-1", "Contacts"))
                    .assertNext(rule -> {
                        assertThat(rule.id()).isEqualTo("rule-old");
                        assertThat(rule.shareType()).isEqualTo("private");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should complete empty when no rule exists")
        void shouldCompleteEmptyWithoutRule() {
            when(sharingRuleRepository.findByOrganizationIdAndModuleNameAndActiveTrueOrderByCreatedAtAscIdAsc(
                    "org-1", "Contacts"))
                    .thenReturn(Flux.empty());

            StepVerifier.create(store.getSharingRule("org-1", "Contacts"))
                    .verifyComplete();
        }

        private SharingRuleDoc ruleDoc(String id, String shareType, String createdAt) {
            return SharingRuleDoc.builder()
                    .id(id)
                    .organizationId("org-1")
                    .moduleName("Contacts")
                    .shareType(shareType)
                    .active(true)
                    .createdAt(Instant.parse(createdAt))
                    .build();
        }
    }
}
