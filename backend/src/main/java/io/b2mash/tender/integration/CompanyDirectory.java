package io.b2mash.tender.integration;

/** Port to the registry of companies allowed to bid. */
public interface CompanyDirectory {

  /**
   * Returns the identity authorized to act for {@code companyId}.
   *
   * @throws io.b2mash.tender.exception.ResourceNotFoundException if the company is unknown
   * @throws io.b2mash.tender.exception.DependencyFailureException if the directory cannot answer
   */
  String lookupRepresentative(long companyId);
}
