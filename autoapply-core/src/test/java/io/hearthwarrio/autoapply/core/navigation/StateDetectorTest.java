package io.hearthwarrio.autoapply.core.navigation;

import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.model.ButtonDescriptor;
import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.FieldType;
import io.hearthwarrio.autoapply.core.model.LabelSource;
import io.hearthwarrio.autoapply.core.model.Locator;
import io.hearthwarrio.autoapply.core.model.NavigationState;
import io.hearthwarrio.autoapply.core.model.PageMetadata;
import io.hearthwarrio.autoapply.core.model.PageModel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class StateDetectorTest {

    private final StateDetector detector = new StateDetector(KeywordTables.defaults());

    @Test
    void jobPostingWithApplyButtonIsDescription() {
        PageModel page = page(List.of(), List.of(button("Apply Now")));

        assertEquals(Optional.of(NavigationState.DESCRIPTION),
                detector.detect(page, "Senior Engineer at Acme", NavigationState.DESCRIPTION));
    }

    @Test
    void passwordAndSignInIsAuth() {
        PageModel page = page(
                List.of(field(FieldType.EMAIL, "Email"), field(FieldType.PASSWORD, "Password")),
                List.of(button("Sign In")));

        assertEquals(Optional.of(NavigationState.AUTH),
                detector.detect(page, "Welcome back", NavigationState.DESCRIPTION));
    }

    @Test
    void personalDetailsFormIsLoggedIn() {
        PageModel page = page(
                List.of(field(FieldType.TEXT, "First Name"), field(FieldType.TEXT, "Last Name"),
                        field(FieldType.TEL, "Phone"), field(FieldType.TEXT, "City")),
                List.of(button("Save and Continue")));

        assertEquals(Optional.of(NavigationState.LOGGED_IN),
                detector.detect(page, "My Information", NavigationState.AUTH));
    }

    @Test
    void confirmationTextIsSubmitted() {
        PageModel page = page(List.of(), List.of(button("Back to jobs")));

        assertEquals(Optional.of(NavigationState.SUBMITTED),
                detector.detect(page, "Thank you for applying! We will reach out to you soon.", NavigationState.LOGGED_IN));
    }

    @Test
    void alreadyAppliedIsSubmittedFromAnyState() {
        PageModel page = page(List.of(field(FieldType.EMAIL, "Email")), List.of(button("Sign In")));

        assertEquals(Optional.of(NavigationState.SUBMITTED),
                detector.detect(page, "It looks like you have already applied for this role.", NavigationState.DESCRIPTION));
    }

    @Test
    void confirmationTextNextToLoginFormIsNotSubmitted() {
        PageModel page = page(
                List.of(field(FieldType.EMAIL, "Email"), field(FieldType.PASSWORD, "Password")),
                List.of(button("Sign In")));

        assertEquals(Optional.of(NavigationState.AUTH),
                detector.detect(page, "Thanks for your interest in Acme", NavigationState.DESCRIPTION));
    }

    private static PageModel page(List<FieldDescriptor> fields, List<ButtonDescriptor> buttons) {
        return new PageModel(new PageMetadata("https://jobs.example.com/1", "Job", false),
                new ArrayList<>(fields), new ArrayList<>(buttons), List.of());
    }

    private static FieldDescriptor field(FieldType type, String label) {
        FieldDescriptor f = new FieldDescriptor("input", Locator.of("//input[@name='" + label + "']"), type);
        f.setLabel(LabelSource.TAG, label);
        return f;
    }

    private static ButtonDescriptor button(String text) {
        ButtonDescriptor b = new ButtonDescriptor("button", Locator.of("//button[.='" + text + "']"));
        b.setText(text);
        return b;
    }
}
