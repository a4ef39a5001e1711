package com.credvault.api.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.credvault.api.dto.Credential;
import com.credvault.api.dto.CredentialOut;
import com.credvault.api.store.DocumentFilter;
import com.credvault.api.store.InMemoryDocumentStore;
import com.credvault.api.store.SubstringFilter;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CredentialServiceTest {

    private InMemoryDocumentStore store;
    private CredentialService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        service = new CredentialService(store, new CredentialMapper());
    }

    private String create(String title, String username) {
        return service.createCredential(Credential.builder()
                .title(title)
                .username(username)
                .password("secret")
                .build());
    }

    @Test
    void emptyQueryMeansMatchAll() {
        assertThat(CredentialService.searchFilter(null)).isSameAs(DocumentFilter.matchAll());
        assertThat(CredentialService.searchFilter("")).isSameAs(DocumentFilter.matchAll());
        assertThat(CredentialService.searchFilter(" ")).isInstanceOf(SubstringFilter.class);
    }

    @Test
    void searchTargetsTitleAndUsername() {
        SubstringFilter filter = (SubstringFilter) CredentialService.searchFilter("git");

        assertThat(filter.getText()).isEqualTo("git");
        assertThat(filter.getFields()).containsExactly("title", "username");
    }

    @Test
    void createdCredentialIsListed() {
        String id = create("GitHub", "alice");

        List<CredentialOut> all = service.listCredentials(null);

        assertThat(all).singleElement().satisfies(out -> {
            assertThat(out.getId()).isEqualTo(id);
            assertThat(out.getTitle()).isEqualTo("GitHub");
            assertThat(out.getUsername()).isEqualTo("alice");
            assertThat(out.getCreatedAt()).isNotNull();
        });
    }

    @Test
    void searchMatchesTitleOrUsernameInAnyCase() {
        String github = create("GitHub", "alice");
        String mail = create("Mail", "ALICE.work");
        String bank = create("Bank", "bob");

        assertThat(service.listCredentials("GIT")).extracting(CredentialOut::getId).containsExactly(github);
        assertThat(service.listCredentials("alice")).extracting(CredentialOut::getId).containsExactly(github, mail);
        assertThat(service.listCredentials("an")).extracting(CredentialOut::getId).containsExactly(bank);
        assertThat(service.listCredentials("nomatch")).isEmpty();
    }

    @Test
    void listPreservesStoreOrder() {
        String first = create("a", "x");
        String second = create("b", "y");
        String third = create("c", "z");

        assertThat(service.listCredentials(null)).extracting(CredentialOut::getId)
                .containsExactly(first, second, third);
    }
}
