package my.companyprofile.app.store;

import my.companyprofile.app.importer.SourceDocument;
import my.companyprofile.app.model.CompanyProfile;

import java.util.List;

/**
 * Storage collaborator. Owns projects and their files, supplies decoded documents and receives the
 * finished profile.
 */
public interface CompanyDocumentStore {
	/**
	 * Decoded documents of a project in upload order. A document that could not be decoded is
	 * returned with its {@code decodeError} set rather than omitted.
	 */
	List<SourceDocument> loadDocuments(String projectId);

	void saveProfile(String projectId, CompanyProfile profile);
}
